package io.ringleader.leader.state;

import io.ringleader.model.ProducerId;

import java.util.List;
import java.util.Objects;

/**
 * Persisted leader state of one consumer group. Only keys and ids are stored
 * here; live handles (barrier, watches) are rebuilt from them.
 * <pre>
 * Init -> ComputingProducerSelection -> Idle -> LostProducer -> WaitingBarrier -> ComputingProducerSelection ...
 * </pre>
 */
public sealed interface LeaderState
        permits LeaderState.Init,
                LeaderState.LostProducer,
                LeaderState.WaitingBarrier,
                LeaderState.ComputingProducerSelection,
                LeaderState.Idle {

    /** Freshly bootstrapped, nothing decided yet. */
    record Init() implements LeaderState {
    }

    /** The active producer died; rendezvous not started. */
    record LostProducer(ProducerId lostProducerId, String executionId) implements LeaderState {
        public LostProducer {
            Objects.requireNonNull(lostProducerId, "lostProducerId");
            Objects.requireNonNull(executionId, "executionId");
        }
    }

    /**
     * Rendezvous in progress.
     *
     * @param waitFor participant keys frozen when the barrier was created
     */
    record WaitingBarrier(long leaseId, String barrierKey, List<String> waitFor) implements LeaderState {
        public WaitingBarrier {
            Objects.requireNonNull(barrierKey, "barrierKey");
            waitFor = List.copyOf(waitFor);
        }
    }

    record ComputingProducerSelection() implements LeaderState {
    }

    /**
     * Steady state.
     *
     * @param executionId generation token, fresh on every entry into this state
     */
    record Idle(ProducerId producerId, String executionId) implements LeaderState {
        public Idle {
            Objects.requireNonNull(producerId, "producerId");
            Objects.requireNonNull(executionId, "executionId");
        }
    }
}
