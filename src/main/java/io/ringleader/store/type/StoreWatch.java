package io.ringleader.store.type;

/**
 * Handle on an open watch. Closing it cancels the watch on the store side.
 */
@FunctionalInterface
public interface StoreWatch extends AutoCloseable {
    @Override
    void close();
}
