package io.ringleader.leader.selection;

import io.ringleader.model.ProducerId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ProducerSelectorTest {

    private static final List<ProducerId> CANDIDATES =
            List.of(new ProducerId("p1"), new ProducerId("p2"), new ProducerId("p3"));

    @Test
    void lowestPicksSmallestId() {
        assertEquals(new ProducerId("p1"),
                new LowestIdProducerSelector().select(List.of(new ProducerId("p3"), new ProducerId("p1"))));
    }

    @Test
    void randomAlwaysReturnsACandidate() {
        final ProducerSelector random = new RandomProducerSelector();
        for (int i = 0; i < 100; i++) {
            assertTrue(CANDIDATES.contains(random.select(CANDIDATES)));
        }
    }

    @Test
    void resolvesByName() {
        assertInstanceOf(RandomProducerSelector.class, ProducerSelector.named("random"));
        assertInstanceOf(LowestIdProducerSelector.class, ProducerSelector.named("LOWEST"));
        assertThrows(IllegalArgumentException.class, () -> ProducerSelector.named("round-robin"));
    }
}
