package io.ringleader;

import io.ringleader.config.impl.LeaderConfig;
import io.ringleader.config.type.ConfigLoader;
import io.ringleader.error.LeaderException;
import io.ringleader.leader.ConsumerGroupLeader;
import io.ringleader.model.ConsumerGroupId;
import io.ringleader.path.KeyPaths;
import io.ringleader.store.impl.EtcdCoordinationStore;
import io.ringleader.store.impl.InMemoryCoordinationStore;
import io.ringleader.store.type.CoordinationStore;
import io.ringleader.store.type.ManagedLease;
import io.ringleader.store.type.StoreFutures;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Main class to start a consumer-group leader process.
 */
@Slf4j
public class Application {
    public static void main(final String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: java -jar ringleader.jar <leader-config.yaml>");
            System.exit(1);
        }

        final LeaderConfig cfg = ConfigLoader.load(args[0]);
        final ConsumerGroupId group = new ConsumerGroupId(cfg.getConsumerGroupId());
        log.info("Starting leader for consumer group {} with {}", group, cfg);

        /* The shutdown hook is the only source of the interrupt */
        final CompletableFuture<Void> interrupt = new CompletableFuture<>();
        final CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, interrupting leader of {}", group);
            interrupt.complete(null);
            try {
                if (!stopped.await(10, TimeUnit.SECONDS)) {
                    log.warn("Leader of {} did not stop within 10s", group);
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "ringleader-shutdown"));

        int exitCode = 0;
        try (final CoordinationStore store = openStore(cfg);
             final ManagedLease lease = StoreFutures.await(store.keepAlive(cfg.getLeaderLeaseTtlSeconds()), "leader lease grant")) {

            log.info("Campaigning for leadership of {} with lease {}", group, Long.toHexString(lease.leaseId()));
            final CompletableFuture<String> lock = store.lock(KeyPaths.leaderLockName(group), lease.leaseId());
            CompletableFuture.anyOf(lock, interrupt).exceptionally(e -> null).get();

            if (interrupt.isDone()) {
                lock.cancel(false);
                log.info("Interrupted before acquiring leadership of {}", group);
            } else {
                final String leaderKey = StoreFutures.await(lock, "leader lock");
                log.info("Became leader of {} holding {}", group, leaderKey);

                final ConsumerGroupLeader leader = ConsumerGroupLeader.open(
                        store, leaderKey, lease, group, ConfigLoader.selector(cfg), ConfigLoader.settings(cfg));
                leader.run(interrupt);
                log.info("Leader of {} stopped in {} at revision {}", group, leader.getState(), leader.getLastRevision());
            }
        } catch (final LeaderException e) {
            log.error("Leader of {} failed, no longer acting as leader", group, e);
            exitCode = 1;
        } finally {
            stopped.countDown();
        }

        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    private static CoordinationStore openStore(final LeaderConfig cfg) {
        return switch (cfg.getStoreType()) {
            case ETCD -> EtcdCoordinationStore.connect(cfg.getEndpoints(), Duration.ofSeconds(cfg.getRequestTimeoutSeconds()));
            case MEMORY -> {
                log.warn("Using the in-memory coordination store; leader state does not outlive this process");
                yield new InMemoryCoordinationStore();
            }
        };
    }
}
