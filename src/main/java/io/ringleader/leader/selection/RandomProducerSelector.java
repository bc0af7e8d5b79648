package io.ringleader.leader.selection;

import io.ringleader.model.ProducerId;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

public final class RandomProducerSelector implements ProducerSelector {
    @Override
    public ProducerId select(final List<ProducerId> candidates) {
        return candidates.get(ThreadLocalRandom.current().nextInt(candidates.size()));
    }
}
