package io.ringleader.path;

import io.ringleader.model.ConsumerGroupId;
import io.ringleader.model.ProducerId;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class KeyPathsTest {

    private static final ConsumerGroupId G1 = new ConsumerGroupId("g1");

    @Test
    void groupKeysAreScopedByGroup() {
        assertEquals("/ringleader/v1/consumer-groups/g1/leader/state-log", KeyPaths.leaderStateLogKey(G1));
        assertEquals("/ringleader/v1/consumer-groups/g1/leader/lock", KeyPaths.leaderLockName(G1));
        assertEquals("/ringleader/v1/consumer-groups/g1/instance-locks/", KeyPaths.instanceLockPrefix(G1));
        assertNotEquals(KeyPaths.leaderStateLogKey(G1), KeyPaths.leaderStateLogKey(new ConsumerGroupId("g2")));
    }

    @Test
    void livenessPrefixDoesNotOverlapBetweenProducers() {
        final String p1 = KeyPaths.producerLivenessPrefix(new ProducerId("p1"));
        final String p10 = KeyPaths.producerLivenessPrefix(new ProducerId("p10"));
        assertTrue(p1.startsWith(KeyPaths.producerLockPrefix()));
        assertFalse(p10.startsWith(p1));
    }

    @Test
    void producerIsParsedFromLockKey() {
        assertEquals(Optional.of(new ProducerId("p7")),
                KeyPaths.producerOf(KeyPaths.producerLivenessPrefix(new ProducerId("p7")) + "694d8a"));
        assertEquals(Optional.empty(), KeyPaths.producerOf(KeyPaths.producerLockPrefix() + "bare"));
        assertEquals(Optional.empty(), KeyPaths.producerOf("/elsewhere/p7/lock"));
    }

    @Test
    void barrierKeysAreUniqueAndArrivalsNested() {
        final String b1 = KeyPaths.newBarrierKey();
        final String b2 = KeyPaths.newBarrierKey();
        assertNotEquals(b1, b2);
        assertEquals("/ringleader/v1/barriers/", KeyPaths.barrierPrefix());
        assertTrue(b1.startsWith(KeyPaths.barrierPrefix()));
        assertEquals(b1 + "/arrived/i1", KeyPaths.barrierArrivalKey(b1, "i1"));
        assertTrue(KeyPaths.barrierArrivalKey(b1, "i1").startsWith(KeyPaths.barrierArrivalPrefix(b1)));
    }

    @Test
    void idsRejectSeparators() {
        assertThrows(IllegalArgumentException.class, () -> new ConsumerGroupId("a/b"));
        assertThrows(IllegalArgumentException.class, () -> new ProducerId(" "));
    }
}
