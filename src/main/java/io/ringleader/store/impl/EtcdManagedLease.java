package io.ringleader.store.impl;

import io.etcd.jetcd.Lease;
import io.ringleader.store.type.ManagedLease;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Refreshes an etcd lease at a third of its TTL until closed.
 */
@Slf4j
final class EtcdManagedLease implements ManagedLease {
    private final Lease leaseClient;
    private final long leaseId;
    private final ScheduledFuture<?> refresher;
    private final AtomicBoolean closed = new AtomicBoolean();

    EtcdManagedLease(final Lease leaseClient,
                     final long leaseId,
                     final long ttlSeconds,
                     final ScheduledExecutorService scheduler) {
        this.leaseClient = leaseClient;
        this.leaseId = leaseId;
        final long periodMillis = Math.max(1_000L, ttlSeconds * 1_000L / 3);
        this.refresher = scheduler.scheduleWithFixedDelay(this::refresh, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public long leaseId() {
        return leaseId;
    }

    private void refresh() {
        leaseClient.keepAliveOnce(leaseId).whenComplete((resp, ex) -> {
            if (ex != null) {
                log.error("Lease {} keep-alive failed", leaseId, ex);
            } else {
                log.trace("Lease {} keep-alive response: TTL={}", leaseId, resp.getTTL());
            }
        });
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        refresher.cancel(false);
        try {
            leaseClient.revoke(leaseId).get(5, TimeUnit.SECONDS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while revoking lease {}", leaseId);
        } catch (final Exception e) {
            log.warn("Failed to revoke lease {}: {}", leaseId, e.toString());
        }
    }
}
