package io.ringleader.leader.state;

import java.util.Objects;

/**
 * Messages a group member sends to the group leader. The leader loop does not
 * consume them yet; the wire form is fixed by {@link LeaderCommandCodec}.
 */
public sealed interface LeaderCommand permits LeaderCommand.Join {

    /**
     * @param lockKey the instance-lock key the joining member holds
     */
    record Join(String lockKey) implements LeaderCommand {
        public Join {
            Objects.requireNonNull(lockKey, "lockKey");
        }
    }
}
