package io.ringleader.store.impl;

import io.ringleader.store.model.KeyValue;
import io.ringleader.store.model.PrefixScan;
import io.ringleader.store.model.TxnCondition;
import io.ringleader.store.model.TxnPut;
import io.ringleader.store.model.TxnResult;
import io.ringleader.store.model.WatchEvent;
import io.ringleader.store.type.CompactedRevisionException;
import io.ringleader.store.type.CoordinationStore;
import io.ringleader.store.type.ManagedLease;
import io.ringleader.store.type.StoreWatch;
import io.ringleader.store.type.WatchListener;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.LongSupplier;

/**
 * Linearizable single-process {@link CoordinationStore}.
 * <p>
 * All mutations are serialized under one monitor and stamped with a store-wide
 * revision. Watch events are queued under the same monitor and delivered in
 * revision order by a single dispatcher thread. Leases do not expire on their
 * own: {@link #expireLeases(long)} reaps those whose TTL elapsed, leases created
 * through {@link #keepAlive(long)} are never reaped.
 * <p>
 * Watch history is bounded. Once more than {@code historyLimit} events are
 * retained the oldest revisions are compacted away, as {@link #compact(long)}
 * does explicitly, and watches asking for them fail.
 */
@Slf4j
public final class InMemoryCoordinationStore implements CoordinationStore {
    private final Object monitor = new Object();
    private final TreeMap<String, KeyValue> data = new TreeMap<>();
    private final Map<Long, Lease> leases = new HashMap<>();
    private final ArrayDeque<WatchEvent> history = new ArrayDeque<>();
    private final List<Watcher> watchers = new ArrayList<>();
    private final ExecutorService dispatcher;
    private final LongSupplier clock;
    private final int historyLimit;
    private long revision = 1L;
    private long compactRevision;
    private long nextLeaseId = 0x1000L;
    private boolean closed;

    public static final int DEFAULT_HISTORY_LIMIT = 10_000;

    public InMemoryCoordinationStore() {
        this(System::currentTimeMillis);
    }

    public InMemoryCoordinationStore(final LongSupplier clock) {
        this(clock, DEFAULT_HISTORY_LIMIT);
    }

    public InMemoryCoordinationStore(final LongSupplier clock, final int historyLimit) {
        if (historyLimit <= 0) throw new IllegalArgumentException("historyLimit must be > 0");
        this.clock = clock;
        this.historyLimit = historyLimit;
        this.dispatcher = Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, "memstore-watch-dispatcher");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<Optional<KeyValue>> get(final String key) {
        synchronized (monitor) {
            if (closed) return closedFuture();
            return CompletableFuture.completedFuture(Optional.ofNullable(data.get(key)).map(InMemoryCoordinationStore::copy));
        }
    }

    @Override
    public CompletableFuture<PrefixScan> scan(final String prefix) {
        synchronized (monitor) {
            if (closed) return closedFuture();
            final List<KeyValue> out = new ArrayList<>();
            for (final KeyValue kv : range(prefix)) {
                out.add(copy(kv));
            }
            return CompletableFuture.completedFuture(new PrefixScan(out, revision));
        }
    }

    @Override
    public CompletableFuture<Long> put(final String key, final byte[] value, final long leaseId) {
        synchronized (monitor) {
            if (closed) return closedFuture();
            if (leaseId != 0L && !leases.containsKey(leaseId)) {
                return CompletableFuture.failedFuture(new IllegalArgumentException("lease not found: " + leaseId));
            }
            revision++;
            applyPut(key, value, leaseId);
            return CompletableFuture.completedFuture(revision);
        }
    }

    @Override
    public CompletableFuture<Long> delete(final String key) {
        synchronized (monitor) {
            if (closed) return closedFuture();
            if (data.containsKey(key)) {
                revision++;
                applyDelete(key);
            }
            return CompletableFuture.completedFuture(revision);
        }
    }

    @Override
    public StoreWatch watch(final String prefix, final long fromRevision, final WatchListener listener) {
        final Watcher watcher = new Watcher(prefix, listener);
        synchronized (monitor) {
            if (closed) throw new IllegalStateException("store closed");
            if (fromRevision > 0 && fromRevision < compactRevision) {
                final CompactedRevisionException compacted = new CompactedRevisionException(fromRevision, compactRevision);
                dispatcher.execute(() -> listener.onError(compacted));
                return () -> watcher.cancelled = true;
            }
            if (fromRevision > 0) {
                for (final WatchEvent ev : history) {
                    if (ev.revision() >= fromRevision && ev.key().startsWith(prefix)) {
                        deliver(watcher, ev);
                    }
                }
            }
            watchers.add(watcher);
        }
        return () -> {
            watcher.cancelled = true;
            synchronized (monitor) {
                watchers.remove(watcher);
            }
        };
    }

    @Override
    public CompletableFuture<Long> grantLease(final long ttlSeconds) {
        synchronized (monitor) {
            if (closed) return closedFuture();
            return CompletableFuture.completedFuture(newLease(ttlSeconds, false).id);
        }
    }

    @Override
    public CompletableFuture<Void> revokeLease(final long leaseId) {
        synchronized (monitor) {
            if (closed) return closedFuture();
            revoke(leaseId);
            return CompletableFuture.completedFuture(null);
        }
    }

    @Override
    public CompletableFuture<ManagedLease> keepAlive(final long ttlSeconds) {
        final long id;
        synchronized (monitor) {
            if (closed) return closedFuture();
            id = newLease(ttlSeconds, true).id;
        }
        return CompletableFuture.completedFuture(new ManagedLease() {
            @Override
            public long leaseId() {
                return id;
            }

            @Override
            public void close() {
                synchronized (monitor) {
                    if (!closed) revoke(id);
                }
            }
        });
    }

    @Override
    public CompletableFuture<String> lock(final String name, final long leaseId) {
        final String prefix = name + "/";
        final String ownKey = prefix + Long.toHexString(leaseId);
        synchronized (monitor) {
            if (closed) return closedFuture();
            if (!leases.containsKey(leaseId)) {
                return CompletableFuture.failedFuture(new IllegalArgumentException("lease not found: " + leaseId));
            }
            if (!data.containsKey(ownKey)) {
                revision++;
                applyPut(ownKey, new byte[0], leaseId);
            }
        }

        final CompletableFuture<String> acquired = new CompletableFuture<>();
        final StoreWatch watch = watch(prefix, new WatchListener() {
            @Override
            public void onEvent(final WatchEvent event) {
                if (event.type() == WatchEvent.Type.DELETE) {
                    tryAcquire(prefix, ownKey, acquired);
                }
            }

            @Override
            public void onError(final Throwable error) {
                acquired.completeExceptionally(error);
            }
        });
        acquired.whenComplete((k, e) -> watch.close());
        tryAcquire(prefix, ownKey, acquired);
        return acquired;
    }

    @Override
    public CompletableFuture<TxnResult> txn(final List<TxnCondition> conditions, final List<TxnPut> puts) {
        synchronized (monitor) {
            if (closed) return closedFuture();
            for (final TxnCondition c : conditions) {
                if (!c.test(data.get(c.key()))) {
                    return CompletableFuture.completedFuture(new TxnResult(false, revision));
                }
            }
            for (final TxnPut p : puts) {
                if (p.leaseId() != 0L && !leases.containsKey(p.leaseId())) {
                    return CompletableFuture.failedFuture(new IllegalArgumentException("lease not found: " + p.leaseId()));
                }
            }
            if (!puts.isEmpty()) {
                revision++;
                for (final TxnPut p : puts) {
                    applyPut(p.key(), p.value(), p.leaseId());
                }
            }
            return CompletableFuture.completedFuture(new TxnResult(true, revision));
        }
    }

    /**
     * Revokes every non-kept-alive lease whose TTL elapsed at {@code nowMillis}.
     *
     * @return number of leases reaped
     */
    public int expireLeases(final long nowMillis) {
        synchronized (monitor) {
            final List<Long> expired = new ArrayList<>();
            for (final Lease l : leases.values()) {
                if (!l.keptAlive && l.deadlineMillis <= nowMillis) expired.add(l.id);
            }
            expired.forEach(this::revoke);
            return expired.size();
        }
    }

    public int expireLeases() {
        return expireLeases(clock.getAsLong());
    }

    /**
     * Discards watch history below {@code rev}. Watches from an older revision
     * fail afterwards.
     */
    public void compact(final long rev) {
        synchronized (monitor) {
            if (rev > revision) {
                throw new IllegalArgumentException("cannot compact to future revision " + rev + ", current is " + revision);
            }
            if (rev <= compactRevision) return;
            while (!history.isEmpty() && history.peekFirst().revision() < rev) {
                history.pollFirst();
            }
            compactRevision = rev;
            log.debug("Watch history compacted to revision {}", rev);
        }
    }

    public long compactRevision() {
        synchronized (monitor) {
            return compactRevision;
        }
    }

    public long currentRevision() {
        synchronized (monitor) {
            return revision;
        }
    }

    @Override
    public void close() {
        synchronized (monitor) {
            if (closed) return;
            closed = true;
            for (final Watcher w : watchers) {
                w.cancelled = true;
            }
            watchers.clear();
        }
        dispatcher.shutdown();
    }

    private void tryAcquire(final String prefix, final String ownKey, final CompletableFuture<String> acquired) {
        final boolean held;
        synchronized (monitor) {
            final KeyValue own = data.get(ownKey);
            if (own == null) {
                held = false;
                acquired.completeExceptionally(new IllegalStateException("lock key released before acquisition: " + ownKey));
            } else {
                boolean first = true;
                for (final KeyValue kv : range(prefix)) {
                    if (kv.createRevision() < own.createRevision()) {
                        first = false;
                        break;
                    }
                }
                held = first;
            }
        }
        if (held) acquired.complete(ownKey);
    }

    private List<KeyValue> range(final String prefix) {
        final List<KeyValue> out = new ArrayList<>();
        for (final KeyValue kv : data.tailMap(prefix, true).values()) {
            if (!kv.key().startsWith(prefix)) break;
            out.add(kv);
        }
        return out;
    }

    private Lease newLease(final long ttlSeconds, final boolean keptAlive) {
        if (ttlSeconds <= 0) throw new IllegalArgumentException("ttlSeconds must be > 0");
        final Lease l = new Lease(nextLeaseId++, clock.getAsLong() + ttlSeconds * 1_000L, keptAlive);
        leases.put(l.id, l);
        return l;
    }

    private void revoke(final long leaseId) {
        final Lease l = leases.remove(leaseId);
        if (l == null || l.keys.isEmpty()) return;
        revision++;
        for (final String key : new ArrayList<>(l.keys)) {
            applyDelete(key);
        }
        log.debug("Lease {} revoked, {} key(s) deleted at revision {}", leaseId, l.keys.size(), revision);
    }

    private void applyPut(final String key, final byte[] value, final long leaseId) {
        final KeyValue prev = data.get(key);
        if (prev != null && prev.leaseId() != 0L && prev.leaseId() != leaseId) {
            final Lease old = leases.get(prev.leaseId());
            if (old != null) old.keys.remove(key);
        }
        final KeyValue kv = new KeyValue(
                key,
                value.clone(),
                prev == null ? revision : prev.createRevision(),
                revision,
                prev == null ? 1L : prev.version() + 1,
                leaseId);
        data.put(key, kv);
        if (leaseId != 0L) leases.get(leaseId).keys.add(key);
        publish(new WatchEvent(WatchEvent.Type.PUT, kv, revision));
    }

    private void applyDelete(final String key) {
        final KeyValue prev = data.remove(key);
        if (prev == null) return;
        if (prev.leaseId() != 0L) {
            final Lease l = leases.get(prev.leaseId());
            if (l != null) l.keys.remove(key);
        }
        final KeyValue tombstone = new KeyValue(key, new byte[0], 0L, revision, 0L, 0L);
        publish(new WatchEvent(WatchEvent.Type.DELETE, tombstone, revision));
    }

    private void publish(final WatchEvent ev) {
        history.addLast(ev);
        // Whole revisions only, so a replay never sees half a transaction.
        while (history.size() > historyLimit) {
            final long oldest = history.peekFirst().revision();
            while (!history.isEmpty() && history.peekFirst().revision() == oldest) {
                history.pollFirst();
            }
            compactRevision = oldest + 1;
        }
        for (final Watcher w : watchers) {
            if (ev.key().startsWith(w.prefix)) deliver(w, ev);
        }
    }

    private void deliver(final Watcher w, final WatchEvent ev) {
        dispatcher.execute(() -> {
            if (w.cancelled) return;
            try {
                w.listener.onEvent(new WatchEvent(ev.type(), copy(ev.keyValue()), ev.revision()));
            } catch (final RuntimeException e) {
                log.warn("Watch listener on {} failed for {}: {}", w.prefix, ev.key(), e.toString());
            }
        });
    }

    private static KeyValue copy(final KeyValue kv) {
        return new KeyValue(kv.key(), kv.value().clone(), kv.createRevision(), kv.modRevision(), kv.version(), kv.leaseId());
    }

    private static <T> CompletableFuture<T> closedFuture() {
        return CompletableFuture.failedFuture(new IllegalStateException("store closed"));
    }

    private static final class Lease {
        final long id;
        final long deadlineMillis;
        final boolean keptAlive;
        final Set<String> keys = new LinkedHashSet<>();

        Lease(final long id, final long deadlineMillis, final boolean keptAlive) {
            this.id = id;
            this.deadlineMillis = deadlineMillis;
            this.keptAlive = keptAlive;
        }
    }

    private static final class Watcher {
        final String prefix;
        final WatchListener listener;
        volatile boolean cancelled;

        Watcher(final String prefix, final WatchListener listener) {
            this.prefix = prefix;
            this.listener = listener;
        }
    }
}
