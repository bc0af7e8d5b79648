package io.ringleader.store;

import io.ringleader.store.type.CoordinationStore;
import io.ringleader.store.type.StoreWatch;
import io.ringleader.store.type.WatchListener;

import java.util.ArrayList;
import java.util.List;

/**
 * Holds every watch back until {@link #register()}, the way a remote store
 * acknowledges a watch some time after the call returned.
 */
public final class LateWatchStore extends ForwardingCoordinationStore {
    private final List<Pending> pending = new ArrayList<>();

    public LateWatchStore(final CoordinationStore delegate) {
        super(delegate);
    }

    @Override
    public synchronized StoreWatch watch(final String prefix, final long fromRevision, final WatchListener listener) {
        final Pending watch = new Pending(prefix, fromRevision, listener);
        pending.add(watch);
        return watch;
    }

    /**
     * Registers every held watch with the underlying store.
     *
     * @return how many watches were registered
     */
    public synchronized int register() {
        final int count = pending.size();
        for (final Pending watch : pending) {
            watch.register();
        }
        pending.clear();
        return count;
    }

    private final class Pending implements StoreWatch {
        private final String prefix;
        private final long fromRevision;
        private final WatchListener listener;
        private StoreWatch registered;
        private boolean closed;

        Pending(final String prefix, final long fromRevision, final WatchListener listener) {
            this.prefix = prefix;
            this.fromRevision = fromRevision;
            this.listener = listener;
        }

        void register() {
            synchronized (LateWatchStore.this) {
                if (!closed) registered = delegate.watch(prefix, fromRevision, listener);
            }
        }

        @Override
        public void close() {
            synchronized (LateWatchStore.this) {
                closed = true;
                if (registered != null) registered.close();
            }
        }
    }
}
