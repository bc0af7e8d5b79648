package io.ringleader.path;

import io.ringleader.model.ConsumerGroupId;
import io.ringleader.model.ProducerId;
import lombok.experimental.UtilityClass;

import java.util.Optional;
import java.util.UUID;

/**
 * Version 1 key layout in the coordination store.
 */
@UtilityClass
public final class KeyPaths {
    private final String ROOT = "/ringleader/v1";
    private final String PRODUCER_LOCKS = ROOT + "/producer-locks/";
    private final String BARRIERS = ROOT + "/barriers/";
    private final String ARRIVED = "/arrived/";

    public String leaderStateLogKey(final ConsumerGroupId group) {
        return groupRoot(group) + "/leader/state-log";
    }

    public String leaderLockName(final ConsumerGroupId group) {
        return groupRoot(group) + "/leader/lock";
    }

    public String instanceLockPrefix(final ConsumerGroupId group) {
        return groupRoot(group) + "/instance-locks/";
    }

    public String producerLockPrefix() {
        return PRODUCER_LOCKS;
    }

    /** Prefix under which a live producer holds its lock key(s). */
    public String producerLivenessPrefix(final ProducerId producer) {
        return PRODUCER_LOCKS + producer.value() + "/";
    }

    /**
     * Extracts the producer id from a key under {@link #producerLockPrefix()}.
     */
    public Optional<ProducerId> producerOf(final String producerLockKey) {
        if (!producerLockKey.startsWith(PRODUCER_LOCKS)) return Optional.empty();
        final String rest = producerLockKey.substring(PRODUCER_LOCKS.length());
        final int slash = rest.indexOf('/');
        if (slash <= 0) return Optional.empty();
        return Optional.of(new ProducerId(rest.substring(0, slash)));
    }

    public String barrierPrefix() {
        return BARRIERS;
    }

    public String newBarrierKey() {
        return BARRIERS + UUID.randomUUID();
    }

    public String barrierArrivalPrefix(final String barrierKey) {
        return barrierKey + ARRIVED;
    }

    public String barrierArrivalKey(final String barrierKey, final String participant) {
        return barrierArrivalPrefix(barrierKey) + participant;
    }

    private String groupRoot(final ConsumerGroupId group) {
        return ROOT + "/consumer-groups/" + group.value();
    }
}
