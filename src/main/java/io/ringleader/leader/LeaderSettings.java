package io.ringleader.leader;

/**
 * @param barrierLeaseTtlSeconds TTL of the lease that carries rendezvous barriers and markers
 */
public record LeaderSettings(long barrierLeaseTtlSeconds) {
    public static final LeaderSettings DEFAULTS = new LeaderSettings(10L);

    public LeaderSettings {
        if (barrierLeaseTtlSeconds <= 0) {
            throw new IllegalArgumentException("barrierLeaseTtlSeconds must be > 0");
        }
    }
}
