package io.ringleader.leader.selection;

import io.ringleader.model.ProducerId;

import java.util.Collections;
import java.util.List;

/** Deterministic: always the smallest producer id. */
public final class LowestIdProducerSelector implements ProducerSelector {
    @Override
    public ProducerId select(final List<ProducerId> candidates) {
        return Collections.min(candidates);
    }
}
