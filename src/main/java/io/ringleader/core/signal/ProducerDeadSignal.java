package io.ringleader.core.signal;

import io.ringleader.error.LeaderException;
import io.ringleader.model.ProducerId;
import io.ringleader.path.KeyPaths;
import io.ringleader.store.model.PrefixScan;
import io.ringleader.store.model.WatchEvent;
import io.ringleader.store.type.CoordinationStore;
import io.ringleader.store.type.StoreFutures;
import io.ringleader.store.type.StoreWatch;
import io.ringleader.store.type.WatchListener;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot notification that a producer's liveness keys were removed.
 * <p>
 * The signal owns a watch on the producer's liveness prefix. Closing it, or the
 * signal resolving, cancels that watch. Use it in try-with-resources or close it
 * explicitly on every exit path.
 */
@Slf4j
public final class ProducerDeadSignal implements AutoCloseable {
    @Getter
    private final ProducerId producer;
    private final CompletableFuture<Void> fired = new CompletableFuture<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile StoreWatch watch;

    private ProducerDeadSignal(final ProducerId producer) {
        this.producer = producer;
    }

    /**
     * Subscribes to the death of {@code producer}. Resolves immediately when no
     * liveness key exists at subscription time.
     *
     * @throws LeaderException {@code STORE_UNAVAILABLE} if the watch or the read fails
     */
    public static ProducerDeadSignal subscribe(final CoordinationStore store, final ProducerId producer) {
        final ProducerDeadSignal signal = new ProducerDeadSignal(producer);
        final String prefix = KeyPaths.producerLivenessPrefix(producer);

        final PrefixScan live = StoreFutures.await(store.scan(prefix), "liveness read for producer " + producer);
        if (live.keyValues().isEmpty()) {
            log.debug("Producer {} has no liveness key at revision {}, signalling immediately", producer, live.revision());
            signal.fired.complete(null);
            return signal;
        }

        // Resume right after the read so a delete in between is replayed, however late the watch registers.
        try {
            signal.watch = store.watch(prefix, live.nextRevision(), signal.new Listener());
        } catch (final RuntimeException e) {
            throw StoreFutures.translate(e, "watch on " + prefix);
        }
        signal.fired.whenComplete((v, e) -> signal.close());
        return signal;
    }

    /**
     * Completes normally when the producer is gone, or exceptionally with
     * {@code CORRUPTED_STATE} or {@code STORE_UNAVAILABLE}.
     */
    public CompletableFuture<Void> future() {
        return fired;
    }

    public boolean isFired() {
        return fired.isDone() && !fired.isCompletedExceptionally();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        final StoreWatch w = watch;
        if (w != null) w.close();
    }

    private final class Listener implements WatchListener {
        @Override
        public void onEvent(final WatchEvent event) {
            switch (event.type()) {
                case DELETE -> {
                    if (!fired.complete(null)) {
                        log.warn("Dead signal for producer {} already resolved, ignoring delete of {}", producer, event.key());
                    }
                }
                case PUT -> {
                    log.error("Corrupted system state: liveness key {} of producer {} was written after the dead-signal subscription",
                            event.key(), producer);
                    fired.completeExceptionally(new LeaderException(LeaderException.Kind.CORRUPTED_STATE,
                            "producer " + producer + " was recreated while presumed dead"));
                }
            }
        }

        @Override
        public void onError(final Throwable error) {
            fired.completeExceptionally(StoreFutures.translate(error, "liveness watch for producer " + producer));
        }
    }
}
