package io.ringleader.store.type;

import io.ringleader.error.LeaderException;
import lombok.experimental.UtilityClass;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Blocking bridge from store futures to {@link LeaderException}.
 */
@UtilityClass
public final class StoreFutures {

    /**
     * Waits for {@code future}. A {@link LeaderException} cause is rethrown as is,
     * anything else becomes {@link LeaderException.Kind#STORE_UNAVAILABLE}.
     */
    public <T> T await(final CompletableFuture<T> future, final String what) {
        try {
            return future.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LeaderException(LeaderException.Kind.STORE_UNAVAILABLE, "interrupted during " + what, e);
        } catch (final ExecutionException e) {
            throw translate(e.getCause(), what);
        } catch (final CancellationException e) {
            throw new LeaderException(LeaderException.Kind.STORE_UNAVAILABLE, what + " was cancelled", e);
        }
    }

    public LeaderException translate(final Throwable error, final String what) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof LeaderException le) return le;
        return new LeaderException(LeaderException.Kind.STORE_UNAVAILABLE, what + " failed: " + cause, cause);
    }
}
