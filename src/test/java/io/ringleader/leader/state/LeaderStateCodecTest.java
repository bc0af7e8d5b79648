package io.ringleader.leader.state;

import io.ringleader.error.LeaderException;
import io.ringleader.model.ProducerId;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class LeaderStateCodecTest {

    @Test
    void waitingBarrierKeepsParticipantOrder() {
        final LeaderState.WaitingBarrier waiting = new LeaderState.WaitingBarrier(
                0x1234L, "/ringleader/v1/barriers/b1",
                List.of("/ringleader/v1/consumer-groups/g1/instance-locks/b", "/ringleader/v1/consumer-groups/g1/instance-locks/a"));

        final LeaderState decoded = LeaderStateCodec.decode(LeaderStateCodec.encode(waiting));
        assertEquals(waiting, decoded);
    }

    @Test
    void everyVariantDecodesToItself() {
        final List<LeaderState> states = List.of(
                new LeaderState.Init(),
                new LeaderState.LostProducer(new ProducerId("p1"), "e1"),
                new LeaderState.WaitingBarrier(7L, "/b", List.of()),
                new LeaderState.ComputingProducerSelection(),
                new LeaderState.Idle(new ProducerId("p2"), "e2"));
        for (final LeaderState s : states) {
            assertEquals(s, LeaderStateCodec.decode(LeaderStateCodec.encode(s)));
        }
    }

    @Test
    void recordStartsWithFormatVersionAndTag() {
        final byte[] raw = LeaderStateCodec.encode(new LeaderState.Idle(new ProducerId("p1"), "e1"));
        assertEquals(1, raw[0]);
        assertEquals(4, raw[1]);
    }

    @Test
    void rejectsMalformedRecords() {
        final byte[] idle = LeaderStateCodec.encode(new LeaderState.Idle(new ProducerId("p1"), "e1"));

        assertCorrupted(new byte[0]);
        assertCorrupted(new byte[]{2, 0});
        assertCorrupted(new byte[]{1, 9});
        assertCorrupted(Arrays.copyOf(idle, idle.length - 1));
        assertCorrupted(Arrays.copyOf(idle, idle.length + 1));
    }

    @Test
    void rejectsInvalidProducerIdInsideRecord() {
        final byte[] raw = LeaderStateCodec.encode(new LeaderState.Idle(new ProducerId("p1"), "e1"));
        // "p1" -> "p/": producer ids cannot contain a slash
        raw[5] = '/';
        assertCorrupted(raw);
    }

    @Test
    void commandCodecHandlesJoin() {
        final LeaderCommand join = new LeaderCommand.Join("/ringleader/v1/consumer-groups/g1/instance-locks/abc");
        assertEquals(join, LeaderCommandCodec.decode(LeaderCommandCodec.encode(join)));

        final LeaderException ex = assertThrows(LeaderException.class,
                () -> LeaderCommandCodec.decode(new byte[]{1, 3}));
        assertEquals(LeaderException.Kind.CORRUPTED_STATE, ex.getKind());
    }

    private static void assertCorrupted(final byte[] raw) {
        final LeaderException ex = assertThrows(LeaderException.class, () -> LeaderStateCodec.decode(raw));
        assertEquals(LeaderException.Kind.CORRUPTED_STATE, ex.getKind());
    }
}
