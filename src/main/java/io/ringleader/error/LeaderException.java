package io.ringleader.error;

import lombok.Getter;

/**
 * Failure raised by the consumer-group leader and its store adapters.
 * <p>
 * Every kind is fatal to the runtime instance that observes it; retries and
 * re-election belong to whoever supervises the leader.
 */
@Getter
public final class LeaderException extends RuntimeException {

    public enum Kind {
        /** Transient store I/O failure; restart the whole runtime. */
        STORE_UNAVAILABLE,
        /** The guarded write did not apply: leadership lost or a concurrent writer won. */
        FAILED_TO_UPDATE_STATE_LOG,
        /** Undecodable state record, or a liveness key recreated while presumed dead. */
        CORRUPTED_STATE,
        /** The rendezvous lease was reaped before every participant arrived. */
        BARRIER_TIMEOUT,
        /** Producer selection found no live candidate. */
        NO_ACTIVE_PRODUCER
    }

    private final Kind kind;

    public LeaderException(final Kind kind, final String message) {
        super(kind + ": " + message);
        this.kind = kind;
    }

    public LeaderException(final Kind kind, final String message, final Throwable cause) {
        super(kind + ": " + message, cause);
        this.kind = kind;
    }

    public boolean is(final Kind other) {
        return kind == other;
    }
}
