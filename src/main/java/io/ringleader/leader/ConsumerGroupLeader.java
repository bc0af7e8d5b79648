package io.ringleader.leader;

import io.ringleader.core.barrier.Barrier;
import io.ringleader.core.barrier.Barriers;
import io.ringleader.core.signal.ProducerDeadSignal;
import io.ringleader.error.LeaderException;
import io.ringleader.leader.selection.ProducerSelector;
import io.ringleader.leader.state.LeaderState;
import io.ringleader.leader.state.LeaderStateCodec;
import io.ringleader.model.ConsumerGroupId;
import io.ringleader.model.ProducerId;
import io.ringleader.path.KeyPaths;
import io.ringleader.store.model.KeyValue;
import io.ringleader.store.model.TxnCondition;
import io.ringleader.store.model.TxnPut;
import io.ringleader.store.model.TxnResult;
import io.ringleader.store.type.CoordinationStore;
import io.ringleader.store.type.ManagedLease;
import io.ringleader.store.type.StoreFutures;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Leader-side failover driver for one consumer group.
 * <p>
 * The persisted {@link LeaderState} is advanced one transition at a time, each
 * write guarded by "the leader lock key still exists" and "the state log was not
 * modified since {@link #getLastRevision()}". A rejected write ends the loop with
 * {@link LeaderException.Kind#FAILED_TO_UPDATE_STATE_LOG}; the caller must then
 * stop acting as leader for the group.
 * <p>
 * Not thread-safe: one thread drives one instance.
 */
@Slf4j
public final class ConsumerGroupLeader {
    @Getter
    private final ConsumerGroupId consumerGroupId;
    private final CoordinationStore store;
    @Getter
    private final String leaderKey;
    @Getter
    private final ManagedLease leaderLease;
    private final ProducerSelector selector;
    private final LeaderSettings settings;
    private final Barriers barriers;
    private final String logKey;

    @Getter
    private LeaderState state;
    @Getter
    private long lastRevision;

    // Runtime-only caches, dropped when the state that created them is left.
    private ProducerDeadSignal deadSignal;
    private Barrier barrier;
    // Producer declared dead by this process, kept out of the next selection.
    private ProducerId lostProducer;

    private ConsumerGroupLeader(final ConsumerGroupId consumerGroupId,
                                final CoordinationStore store,
                                final String leaderKey,
                                final ManagedLease leaderLease,
                                final ProducerSelector selector,
                                final LeaderSettings settings,
                                final LeaderState state,
                                final long lastRevision) {
        this.consumerGroupId = consumerGroupId;
        this.store = store;
        this.leaderKey = leaderKey;
        this.leaderLease = leaderLease;
        this.selector = selector;
        this.settings = settings;
        this.barriers = new Barriers(store);
        this.logKey = KeyPaths.leaderStateLogKey(consumerGroupId);
        this.state = state;
        this.lastRevision = lastRevision;
    }

    public static ConsumerGroupLeader open(final CoordinationStore store,
                                           final String leaderKey,
                                           final ManagedLease leaderLease,
                                           final ConsumerGroupId consumerGroupId,
                                           final ProducerSelector selector) {
        return open(store, leaderKey, leaderLease, consumerGroupId, selector, LeaderSettings.DEFAULTS);
    }

    /**
     * Loads the group's state log, or writes {@code Init} if the group has none.
     *
     * @param leaderKey   key proving ownership of the group's leader lock
     * @param leaderLease lease the leader lock lives on, already acquired
     * @throws LeaderException {@code FAILED_TO_UPDATE_STATE_LOG} if the lock is gone or
     *                         another initializer won, {@code CORRUPTED_STATE} if the log
     *                         cannot be decoded, {@code STORE_UNAVAILABLE} on store errors
     */
    public static ConsumerGroupLeader open(final CoordinationStore store,
                                           final String leaderKey,
                                           final ManagedLease leaderLease,
                                           final ConsumerGroupId consumerGroupId,
                                           final ProducerSelector selector,
                                           final LeaderSettings settings) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(leaderKey, "leaderKey");
        Objects.requireNonNull(consumerGroupId, "consumerGroupId");
        Objects.requireNonNull(selector, "selector");
        Objects.requireNonNull(settings, "settings");

        final String logKey = KeyPaths.leaderStateLogKey(consumerGroupId);
        final Optional<KeyValue> existing = StoreFutures.await(store.get(logKey), "state log read");

        final LeaderState state;
        final long revision;
        if (existing.isPresent()) {
            state = LeaderStateCodec.decode(existing.get().value());
            revision = existing.get().modRevision();
            log.info("Consumer group {} leader resumes in {} at revision {}", consumerGroupId, state, revision);
        } else {
            state = new LeaderState.Init();
            final TxnResult res = StoreFutures.await(store.txn(
                    List.of(TxnCondition.versionGreater(leaderKey, 0L),
                            TxnCondition.versionEquals(logKey, 0L)),
                    List.of(TxnPut.of(logKey, LeaderStateCodec.encode(state)))), "state log init");
            if (!res.succeeded()) {
                throw new LeaderException(LeaderException.Kind.FAILED_TO_UPDATE_STATE_LOG,
                        "could not initialize state log of " + consumerGroupId
                                + ": leader lock lost or log initialized concurrently");
            }
            revision = res.revision();
            log.info("Consumer group {} state log initialized at revision {}", consumerGroupId, revision);
        }
        return new ConsumerGroupLeader(consumerGroupId, store, leaderKey, leaderLease, selector, settings, state, revision);
    }

    /**
     * Drives the state machine until {@code interrupt} completes or an error occurs.
     * Completion of {@code interrupt} (normally or not) is a clean exit: the last
     * persisted state stays authoritative and nothing partial is written.
     *
     * @throws LeaderException on any store, corruption or fencing failure
     */
    public void run(final CompletableFuture<?> interrupt) {
        Objects.requireNonNull(interrupt, "interrupt");
        // One callback per run; every wait of this run is armed against it.
        final Interruption interruption = new Interruption();
        interrupt.whenComplete((v, e) -> interruption.fire());
        try {
            while (true) {
                if (!advance(interruption)) {
                    log.info("Consumer group {} leader interrupted in {}", consumerGroupId, state);
                    return;
                }
                if (interruption.fired()) {
                    log.info("Consumer group {} leader interrupted after reaching {}", consumerGroupId, state);
                    return;
                }
            }
        } finally {
            releaseDeadSignal();
        }
    }

    /**
     * Performs and persists a single transition without an interrupt.
     * Blocks while the current state waits on the store.
     */
    void step() {
        advance(new Interruption());
    }

    private boolean advance(final Interruption interruption) {
        final Optional<LeaderState> next = nextState(interruption);
        if (next.isEmpty()) return false;
        persist(next.get());
        return true;
    }

    /**
     * Computes the successor of the current state, performing the side effects
     * the transition needs. Empty when the interrupt fired during a wait.
     */
    private Optional<LeaderState> nextState(final Interruption interrupt) {
        final LeaderState current = state;
        if (current instanceof LeaderState.Init) {
            return Optional.of(new LeaderState.ComputingProducerSelection());
        } else if (current instanceof LeaderState.LostProducer lost) {
            log.info("Consumer group {} starting rendezvous after losing producer {}", consumerGroupId, lost.lostProducerId());
            lostProducer = lost.lostProducerId();
            return Optional.of(stageRendezvous());
        } else if (current instanceof LeaderState.WaitingBarrier waiting) {
            return awaitRendezvous(waiting, interrupt);
        } else if (current instanceof LeaderState.ComputingProducerSelection) {
            return Optional.of(selectProducer());
        } else if (current instanceof LeaderState.Idle idle) {
            return watchProducer(idle, interrupt);
        }
        throw new IllegalStateException("Unknown leader state " + current);
    }

    private LeaderState.WaitingBarrier stageRendezvous() {
        final String barrierKey = KeyPaths.newBarrierKey();
        final long leaseId = StoreFutures.await(store.grantLease(settings.barrierLeaseTtlSeconds()), "barrier lease grant");
        final List<String> waitFor = StoreFutures.await(
                        store.getPrefix(KeyPaths.instanceLockPrefix(consumerGroupId)), "instance lock scan")
                .stream()
                .map(KeyValue::key)
                .toList();
        barrier = barriers.create(barrierKey, waitFor, leaseId);
        return new LeaderState.WaitingBarrier(leaseId, barrierKey, waitFor);
    }

    private Optional<LeaderState> awaitRendezvous(final LeaderState.WaitingBarrier waiting,
                                                  final Interruption interrupt) {
        try {
            if (barrier == null || !barrier.key().equals(waiting.barrierKey())) {
                barrier = barriers.attach(waiting.barrierKey());
            }
            final CompletableFuture<Void> arrivals = barrier.await();
            if (interruptedWhile(arrivals, interrupt, "barrier " + waiting.barrierKey())) {
                arrivals.cancel(false);
                return Optional.empty();
            }
            log.info("Consumer group {}: all {} participant(s) reached barrier {}",
                    consumerGroupId, waiting.waitFor().size(), waiting.barrierKey());
            return Optional.of(new LeaderState.ComputingProducerSelection());
        } catch (final LeaderException e) {
            if (!e.is(LeaderException.Kind.BARRIER_TIMEOUT)) throw e;
            log.warn("Consumer group {}: barrier {} expired before every participant arrived, restaging rendezvous",
                    consumerGroupId, waiting.barrierKey());
            return Optional.of(stageRendezvous());
        }
    }

    private LeaderState.Idle selectProducer() {
        final List<ProducerId> candidates = StoreFutures.await(
                        store.getPrefix(KeyPaths.producerLockPrefix()), "producer lock scan")
                .stream()
                .map(kv -> KeyPaths.producerOf(kv.key()))
                .flatMap(Optional::stream)
                .distinct()
                .filter(p -> !p.equals(lostProducer))
                .sorted()
                .toList();
        if (candidates.isEmpty()) {
            throw new LeaderException(LeaderException.Kind.NO_ACTIVE_PRODUCER,
                    "no live producer to assign to consumer group " + consumerGroupId);
        }
        final ProducerId chosen = selector.select(candidates);
        if (!candidates.contains(chosen)) {
            throw new IllegalStateException("selector returned " + chosen + " which is not among " + candidates);
        }
        final String executionId = UUID.randomUUID().toString();
        log.info("Consumer group {} selected producer {} out of {} (execution {})",
                consumerGroupId, chosen, candidates.size(), executionId);
        return new LeaderState.Idle(chosen, executionId);
    }

    private Optional<LeaderState> watchProducer(final LeaderState.Idle idle, final Interruption interrupt) {
        if (deadSignal != null && !deadSignal.getProducer().equals(idle.producerId())) {
            releaseDeadSignal();
        }
        if (deadSignal == null) {
            deadSignal = ProducerDeadSignal.subscribe(store, idle.producerId());
        }
        if (interruptedWhile(deadSignal.future(), interrupt, "dead signal of producer " + idle.producerId())) {
            return Optional.empty();
        }

        log.warn("Received dead signal from producer {} of consumer group {}", idle.producerId(), consumerGroupId);
        // Transient marker on its own short lease; nothing reads it back.
        final String markerKey = KeyPaths.newBarrierKey();
        final long leaseId = StoreFutures.await(store.grantLease(settings.barrierLeaseTtlSeconds()), "marker lease grant");
        StoreFutures.await(store.put(markerKey, new byte[0], leaseId), "marker write");

        lostProducer = idle.producerId();
        return Optional.of(new LeaderState.LostProducer(idle.producerId(), idle.executionId()));
    }

    private void persist(final LeaderState next) {
        final TxnResult res = StoreFutures.await(store.txn(
                List.of(TxnCondition.versionGreater(leaderKey, 0L),
                        TxnCondition.modRevisionEquals(logKey, lastRevision)),
                List.of(TxnPut.of(logKey, LeaderStateCodec.encode(next)))), "state log update");
        if (!res.succeeded()) {
            throw new LeaderException(LeaderException.Kind.FAILED_TO_UPDATE_STATE_LOG,
                    "write of " + next + " for " + consumerGroupId + " rejected at revision " + lastRevision
                            + ": leader lock lost or state log changed concurrently");
        }
        log.info("Consumer group {} leader: {} -> {} at revision {}", consumerGroupId, state, next, res.revision());
        state = next;
        lastRevision = res.revision();

        if (!(next instanceof LeaderState.Idle)) releaseDeadSignal();
        if (!(next instanceof LeaderState.WaitingBarrier)) barrier = null;
        if (next instanceof LeaderState.Idle) lostProducer = null;
    }

    /**
     * Waits for {@code work} or {@code interrupt}, whichever completes first.
     * The interrupt wins a tie.
     *
     * @return true if the interrupt completed
     * @throws LeaderException if {@code work} failed before the interrupt
     */
    private boolean interruptedWhile(final CompletableFuture<?> work,
                                     final Interruption interrupt,
                                     final String what) {
        final CompletableFuture<Boolean> race = interrupt.arm();
        work.whenComplete((v, e) -> race.complete(false));
        try {
            if (StoreFutures.await(race, "wait for " + what) || interrupt.fired()) return true;
        } finally {
            interrupt.disarm();
        }
        StoreFutures.await(work, what);
        return false;
    }

    /**
     * Bridges the caller's interrupt future to whichever wait is in progress.
     */
    private static final class Interruption {
        private final AtomicReference<CompletableFuture<Boolean>> pending = new AtomicReference<>();
        private volatile boolean fired;

        void fire() {
            fired = true;
            final CompletableFuture<Boolean> wait = pending.get();
            if (wait != null) wait.complete(true);
        }

        boolean fired() {
            return fired;
        }

        CompletableFuture<Boolean> arm() {
            final CompletableFuture<Boolean> wait = new CompletableFuture<>();
            pending.set(wait);
            if (fired) wait.complete(true);
            return wait;
        }

        void disarm() {
            pending.set(null);
        }
    }

    private void releaseDeadSignal() {
        if (deadSignal != null) {
            deadSignal.close();
            deadSignal = null;
        }
    }
}
