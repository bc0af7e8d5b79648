package io.ringleader.store.type;

import io.ringleader.store.model.WatchEvent;

/**
 * Receives watch events in revision order on a store-owned thread.
 * Implementations must not block.
 */
public interface WatchListener {

    void onEvent(WatchEvent event);

    /** The stream terminated abnormally; no further events follow. */
    void onError(Throwable error);
}
