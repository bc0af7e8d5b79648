package io.ringleader.core.barrier;

import io.ringleader.error.LeaderException;
import io.ringleader.store.model.KeyValue;
import io.ringleader.store.model.TxnCondition;
import io.ringleader.store.model.TxnPut;
import io.ringleader.store.model.TxnResult;
import io.ringleader.store.type.CoordinationStore;
import io.ringleader.store.type.StoreFutures;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Creates barriers in the coordination store, or re-attaches to one by key
 * after the in-memory handle was lost.
 */
@Slf4j
@RequiredArgsConstructor
public final class Barriers {
    private final CoordinationStore store;

    /**
     * Registers a new barrier under {@code key}. The barrier record lives on
     * {@code leaseId} and disappears with it.
     *
     * @throws LeaderException {@code CORRUPTED_STATE} if the key is already taken
     */
    public Barrier create(final String key, final List<String> participants, final long leaseId) {
        Objects.requireNonNull(key, "key");
        final StoreBarrier barrier = new StoreBarrier(store, key, leaseId, participants);
        final TxnResult res = StoreFutures.await(store.txn(
                List.of(TxnCondition.versionEquals(key, 0L)),
                List.of(new TxnPut(key, barrier.encode(), leaseId))), "barrier create");
        if (!res.succeeded()) {
            throw new LeaderException(LeaderException.Kind.CORRUPTED_STATE, "barrier key already in use: " + key);
        }
        log.info("Barrier {} created on lease {} waiting for {} participant(s)", key, leaseId, participants.size());
        return barrier;
    }

    /**
     * @throws LeaderException {@code BARRIER_TIMEOUT} if the barrier record is gone
     */
    public Barrier attach(final String key) {
        final Optional<KeyValue> root = StoreFutures.await(store.get(key), "barrier attach");
        if (root.isEmpty()) {
            throw new LeaderException(LeaderException.Kind.BARRIER_TIMEOUT, "barrier " + key + " no longer exists");
        }
        return StoreBarrier.decode(store, key, root.get().value());
    }
}
