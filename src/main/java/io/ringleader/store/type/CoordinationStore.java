package io.ringleader.store.type;

import io.ringleader.store.model.KeyValue;
import io.ringleader.store.model.PrefixScan;
import io.ringleader.store.model.TxnCondition;
import io.ringleader.store.model.TxnPut;
import io.ringleader.store.model.TxnResult;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Linearizable hierarchical key-value store with prefix scans, watches,
 * leases and guarded multi-key transactions.
 * <p>
 * Every mutation advances a store-wide revision. Futures complete
 * exceptionally when the store cannot be reached.
 */
public interface CoordinationStore extends AutoCloseable {

    CompletableFuture<Optional<KeyValue>> get(String key);

    /**
     * Reads every key starting with {@code prefix}, ordered by key, together
     * with the store revision the read was served at.
     */
    CompletableFuture<PrefixScan> scan(String prefix);

    default CompletableFuture<List<KeyValue>> getPrefix(final String prefix) {
        return scan(prefix).thenApply(PrefixScan::keyValues);
    }

    /**
     * Writes {@code value} under {@code key}, attached to {@code leaseId} unless it is 0.
     *
     * @return the revision of the write
     */
    CompletableFuture<Long> put(String key, byte[] value, long leaseId);

    /**
     * @return the store revision after the delete
     */
    CompletableFuture<Long> delete(String key);

    /**
     * Streams changes to keys under {@code prefix}. With {@code fromRevision} 0 the
     * stream starts at whatever change follows its server-side registration, which
     * may lag behind this call. Otherwise it delivers every change from that
     * revision on; a revision already compacted ends the stream through
     * {@link WatchListener#onError} ({@link CompactedRevisionException} in the
     * in-process store, the client's compaction error for etcd).
     */
    StoreWatch watch(String prefix, long fromRevision, WatchListener listener);

    default StoreWatch watch(final String prefix, final WatchListener listener) {
        return watch(prefix, 0L, listener);
    }

    CompletableFuture<Long> grantLease(long ttlSeconds);

    /**
     * Revokes the lease and deletes every key attached to it.
     */
    CompletableFuture<Void> revokeLease(long leaseId);

    /**
     * Grants a lease that is kept alive until the returned handle is closed.
     */
    CompletableFuture<ManagedLease> keepAlive(long ttlSeconds);

    /**
     * Acquires the named mutual-exclusion lock on behalf of {@code leaseId}.
     * Completes once the lock is held.
     *
     * @return the key that represents ownership; it exists exactly as long as the lock is held
     */
    CompletableFuture<String> lock(String name, long leaseId);

    /**
     * Applies every put at a single revision if and only if every condition holds.
     */
    CompletableFuture<TxnResult> txn(List<TxnCondition> conditions, List<TxnPut> puts);

    @Override
    void close();
}
