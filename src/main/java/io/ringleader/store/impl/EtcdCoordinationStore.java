package io.ringleader.store.impl;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import io.etcd.jetcd.options.WatchOption;
import io.ringleader.store.model.KeyValue;
import io.ringleader.store.model.PrefixScan;
import io.ringleader.store.model.TxnCondition;
import io.ringleader.store.model.TxnPut;
import io.ringleader.store.model.TxnResult;
import io.ringleader.store.model.WatchEvent;
import io.ringleader.store.type.CoordinationStore;
import io.ringleader.store.type.ManagedLease;
import io.ringleader.store.type.StoreWatch;
import io.ringleader.store.type.WatchListener;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * {@link CoordinationStore} backed by an etcd v3 cluster through jetcd.
 * Unary calls are bounded by the configured request timeout; lock
 * acquisition and watches are not.
 */
@Slf4j
public final class EtcdCoordinationStore implements CoordinationStore {
    private final Client client;
    private final KV kv;
    private final Duration requestTimeout;
    private final ScheduledExecutorService keepAliveScheduler;

    public EtcdCoordinationStore(final Client client, final Duration requestTimeout) {
        this.client = client;
        this.kv = client.getKVClient();
        this.requestTimeout = requestTimeout;
        this.keepAliveScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "etcd-lease-keepalive");
            t.setDaemon(true);
            return t;
        });
    }

    public static EtcdCoordinationStore connect(final List<String> endpoints, final Duration requestTimeout) {
        final Client client = Client.builder()
                .endpoints(endpoints.toArray(new String[0]))
                .build();
        log.info("etcd client initialized: endpoints={}", endpoints);
        return new EtcdCoordinationStore(client, requestTimeout);
    }

    @Override
    public CompletableFuture<Optional<KeyValue>> get(final String key) {
        return bounded(kv.get(bytes(key))
                .thenApply(r -> r.getKvs().stream().findFirst().map(EtcdCoordinationStore::toKeyValue)));
    }

    @Override
    public CompletableFuture<PrefixScan> scan(final String prefix) {
        final GetOption option = GetOption.builder().isPrefix(true).build();
        return bounded(kv.get(bytes(prefix), option)
                .thenApply(r -> new PrefixScan(
                        r.getKvs().stream()
                                .map(EtcdCoordinationStore::toKeyValue)
                                .sorted(Comparator.comparing(KeyValue::key))
                                .toList(),
                        r.getHeader().getRevision())));
    }

    @Override
    public CompletableFuture<Long> put(final String key, final byte[] value, final long leaseId) {
        return bounded(kv.put(bytes(key), ByteSequence.from(value), putOption(leaseId))
                .thenApply(r -> r.getHeader().getRevision()));
    }

    @Override
    public CompletableFuture<Long> delete(final String key) {
        return bounded(kv.delete(bytes(key)).thenApply(r -> r.getHeader().getRevision()));
    }

    @Override
    public StoreWatch watch(final String prefix, final long fromRevision, final WatchListener listener) {
        final WatchOption.Builder option = WatchOption.builder().isPrefix(true);
        if (fromRevision > 0) option.withRevision(fromRevision);

        final Watch.Watcher watcher = client.getWatchClient().watch(bytes(prefix), option.build(), Watch.listener(
                response -> response.getEvents().forEach(ev -> {
                    final WatchEvent.Type type = switch (ev.getEventType()) {
                        case PUT -> WatchEvent.Type.PUT;
                        case DELETE -> WatchEvent.Type.DELETE;
                        default -> null;
                    };
                    if (type == null) {
                        log.debug("Ignoring unrecognized watch event on {}", prefix);
                        return;
                    }
                    final KeyValue keyValue = toKeyValue(ev.getKeyValue());
                    listener.onEvent(new WatchEvent(type, keyValue, keyValue.modRevision()));
                }),
                listener::onError));
        return watcher::close;
    }

    @Override
    public CompletableFuture<Long> grantLease(final long ttlSeconds) {
        return bounded(client.getLeaseClient().grant(ttlSeconds).thenApply(r -> r.getID()));
    }

    @Override
    public CompletableFuture<Void> revokeLease(final long leaseId) {
        return bounded(client.getLeaseClient().revoke(leaseId).thenApply(r -> null));
    }

    @Override
    public CompletableFuture<ManagedLease> keepAlive(final long ttlSeconds) {
        return grantLease(ttlSeconds)
                .thenApply(id -> new EtcdManagedLease(client.getLeaseClient(), id, ttlSeconds, keepAliveScheduler));
    }

    @Override
    public CompletableFuture<String> lock(final String name, final long leaseId) {
        return client.getLockClient().lock(bytes(name), leaseId)
                .thenApply(r -> r.getKey().toString(StandardCharsets.UTF_8));
    }

    @Override
    public CompletableFuture<TxnResult> txn(final List<TxnCondition> conditions, final List<TxnPut> puts) {
        final Cmp[] cmps = conditions.stream().map(EtcdCoordinationStore::toCmp).toArray(Cmp[]::new);
        final Op[] ops = puts.stream()
                .map(p -> Op.put(bytes(p.key()), ByteSequence.from(p.value()), putOption(p.leaseId())))
                .toArray(Op[]::new);
        return bounded(kv.txn().If(cmps).Then(ops).commit()
                .thenApply(r -> new TxnResult(r.isSucceeded(), r.getHeader().getRevision())));
    }

    @Override
    public void close() {
        keepAliveScheduler.shutdownNow();
        client.close();
    }

    private <T> CompletableFuture<T> bounded(final CompletableFuture<T> future) {
        return future.orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static Cmp toCmp(final TxnCondition c) {
        final Cmp.Op op = switch (c.op()) {
            case EQUAL -> Cmp.Op.EQUAL;
            case GREATER -> Cmp.Op.GREATER;
            case LESS -> Cmp.Op.LESS;
        };
        final CmpTarget<?> target = c.target() == TxnCondition.Target.VERSION
                ? CmpTarget.version(c.operand())
                : CmpTarget.modRevision(c.operand());
        return new Cmp(bytes(c.key()), op, target);
    }

    private static PutOption putOption(final long leaseId) {
        return leaseId == 0L ? PutOption.DEFAULT : PutOption.builder().withLeaseId(leaseId).build();
    }

    private static KeyValue toKeyValue(final io.etcd.jetcd.KeyValue kv) {
        return new KeyValue(
                kv.getKey().toString(StandardCharsets.UTF_8),
                kv.getValue().getBytes(),
                kv.getCreateRevision(),
                kv.getModRevision(),
                kv.getVersion(),
                kv.getLease());
    }

    private static ByteSequence bytes(final String s) {
        return ByteSequence.from(s, StandardCharsets.UTF_8);
    }
}
