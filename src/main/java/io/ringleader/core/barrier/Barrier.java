package io.ringleader.core.barrier;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Rendezvous point over a frozen set of participant keys, bound to a lease.
 */
public interface Barrier {

    String key();

    long leaseId();

    List<String> participants();

    /** Records the arrival of {@code participant}. */
    CompletableFuture<Void> arrive(String participant);

    /**
     * Completes once every participant has arrived. Never completes while a
     * participant is missing, unless the barrier lease is reaped first, in which
     * case it fails with {@link io.ringleader.error.LeaderException.Kind#BARRIER_TIMEOUT}.
     * Cancelling the returned future releases the underlying watch.
     */
    CompletableFuture<Void> await();
}
