package io.ringleader.store.type;

import io.ringleader.error.LeaderException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

final class StoreFuturesTest {

    @Test
    void returnsValue() {
        assertEquals("v", StoreFutures.await(CompletableFuture.completedFuture("v"), "read"));
    }

    @Test
    void storeFailureBecomesUnavailable() {
        final IOException io = new IOException("connection refused");
        final LeaderException ex = assertThrows(LeaderException.class,
                () -> StoreFutures.await(CompletableFuture.failedFuture(io), "read"));
        assertEquals(LeaderException.Kind.STORE_UNAVAILABLE, ex.getKind());
        assertSame(io, ex.getCause());
    }

    @Test
    void leaderFailureIsRethrownAsIs() {
        final LeaderException timeout = new LeaderException(LeaderException.Kind.BARRIER_TIMEOUT, "gone");
        assertSame(timeout, assertThrows(LeaderException.class,
                () -> StoreFutures.await(CompletableFuture.failedFuture(new CompletionException(timeout)), "await")));
    }

    @Test
    void cancellationIsUnavailable() {
        final CompletableFuture<Void> f = new CompletableFuture<>();
        f.cancel(false);
        assertTrue(assertThrows(LeaderException.class, () -> StoreFutures.await(f, "await"))
                .is(LeaderException.Kind.STORE_UNAVAILABLE));
    }

    @Test
    void interruptionKeepsFlag() {
        Thread.currentThread().interrupt();
        try {
            final LeaderException ex = assertThrows(LeaderException.class,
                    () -> StoreFutures.await(new CompletableFuture<Void>(), "await"));
            assertEquals(LeaderException.Kind.STORE_UNAVAILABLE, ex.getKind());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
