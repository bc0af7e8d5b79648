package io.ringleader.leader.selection;

import io.ringleader.model.ProducerId;

import java.util.List;
import java.util.Locale;

/**
 * Picks the producer a consumer group follows after a failover.
 * <p>
 * Called with the live producers, sorted by id, never empty. The producer
 * lost in the previous epoch is already filtered out. Must return one of
 * the candidates.
 */
@FunctionalInterface
public interface ProducerSelector {

    ProducerId select(List<ProducerId> candidates);

    /**
     * Resolves a selector by its configuration name: {@code random} or {@code lowest}.
     */
    static ProducerSelector named(final String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "random" -> new RandomProducerSelector();
            case "lowest" -> new LowestIdProducerSelector();
            default -> throw new IllegalArgumentException("Unknown producer selector: " + name);
        };
    }
}
