package io.ringleader.store.type;

/**
 * A lease kept alive in the background. Closing stops the keep-alive and
 * revokes the lease, which releases every key attached to it.
 */
public interface ManagedLease extends AutoCloseable {

    long leaseId();

    @Override
    void close();
}
