package io.ringleader.core.barrier;

import io.ringleader.error.LeaderException;
import io.ringleader.path.KeyPaths;
import io.ringleader.store.LateWatchStore;
import io.ringleader.store.impl.InMemoryCoordinationStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class BarriersTest {

    private final AtomicLong now = new AtomicLong();
    private final InMemoryCoordinationStore store = new InMemoryCoordinationStore(now::get);
    private final Barriers barriers = new Barriers(store);

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void completesOnlyAfterEveryParticipantArrived() throws Exception {
        final long lease = store.grantLease(10L).get();
        final Barrier barrier = barriers.create(KeyPaths.newBarrierKey(), List.of("i1", "i2"), lease);

        final CompletableFuture<Void> done = barrier.await();
        barrier.arrive("i1").get();
        assertThrows(TimeoutException.class, () -> done.get(200, TimeUnit.MILLISECONDS));

        barrier.arrive("i2").get();
        done.get(5, TimeUnit.SECONDS);
    }

    @Test
    void arrivalsBeforeAwaitAreCounted() throws Exception {
        final long lease = store.grantLease(10L).get();
        final Barrier barrier = barriers.create(KeyPaths.newBarrierKey(), List.of("i1"), lease);
        barrier.arrive("i1").get();

        barrier.await().get(5, TimeUnit.SECONDS);
    }

    @Test
    void arrivalsBeforeWatchRegistrationAreCounted() throws Exception {
        final long lease = store.grantLease(10L).get();
        final LateWatchStore late = new LateWatchStore(store);
        final Barrier barrier = new Barriers(late).create(KeyPaths.newBarrierKey(), List.of("i1", "i2"), lease);

        final CompletableFuture<Void> done = barrier.await();
        barrier.arrive("i1").get();
        barrier.arrive("i2").get();
        assertFalse(done.isDone());

        assertEquals(1, late.register());
        done.get(5, TimeUnit.SECONDS);
    }

    @Test
    void emptyParticipantListCompletesImmediately() throws Exception {
        final long lease = store.grantLease(10L).get();
        final Barrier barrier = barriers.create(KeyPaths.newBarrierKey(), List.of(), lease);
        assertTrue(barrier.await().isDone());
    }

    @Test
    void attachRestoresParticipantsAndLease() throws Exception {
        final long lease = store.grantLease(10L).get();
        final String key = KeyPaths.newBarrierKey();
        barriers.create(key, List.of("i1", "i2"), lease).arrive("i2").get();

        final Barrier resumed = barriers.attach(key);
        assertEquals(key, resumed.key());
        assertEquals(lease, resumed.leaseId());
        assertEquals(List.of("i1", "i2"), resumed.participants());

        final CompletableFuture<Void> done = resumed.await();
        resumed.arrive("i1").get();
        done.get(5, TimeUnit.SECONDS);
    }

    @Test
    void leaseExpiryFailsWaitersWithBarrierTimeout() throws Exception {
        final long lease = store.grantLease(1L).get();
        final String key = KeyPaths.newBarrierKey();
        final Barrier barrier = barriers.create(key, List.of("i1"), lease);
        final CompletableFuture<Void> done = barrier.await();

        now.set(5_000L);
        store.expireLeases();

        final ExecutionException ex = assertThrows(ExecutionException.class, () -> done.get(5, TimeUnit.SECONDS));
        final LeaderException le = assertInstanceOf(LeaderException.class, ex.getCause());
        assertEquals(LeaderException.Kind.BARRIER_TIMEOUT, le.getKind());

        final LeaderException attach = assertThrows(LeaderException.class, () -> barriers.attach(key));
        assertEquals(LeaderException.Kind.BARRIER_TIMEOUT, attach.getKind());
    }

    @Test
    void duplicateKeyIsRejected() throws Exception {
        final long lease = store.grantLease(10L).get();
        final String key = KeyPaths.newBarrierKey();
        barriers.create(key, List.of("i1"), lease);

        final LeaderException ex = assertThrows(LeaderException.class,
                () -> barriers.create(key, List.of("i2"), lease));
        assertEquals(LeaderException.Kind.CORRUPTED_STATE, ex.getKind());
    }

    @Test
    void strangersCannotArrive() throws Exception {
        final long lease = store.grantLease(10L).get();
        final Barrier barrier = barriers.create(KeyPaths.newBarrierKey(), List.of("i1"), lease);

        final ExecutionException ex = assertThrows(ExecutionException.class, () -> barrier.arrive("i9").get());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    @Test
    void unreadableRecordIsCorruption() throws Exception {
        final String key = KeyPaths.newBarrierKey();
        store.put(key, new byte[]{9, 9}, 0L).get();

        final LeaderException ex = assertThrows(LeaderException.class, () -> barriers.attach(key));
        assertEquals(LeaderException.Kind.CORRUPTED_STATE, ex.getKind());
    }
}
