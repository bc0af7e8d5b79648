package io.ringleader.config.type;

import io.ringleader.config.impl.LeaderConfig;
import io.ringleader.leader.LeaderSettings;
import io.ringleader.leader.selection.ProducerSelector;

import java.io.IOException;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads leader configuration from a YAML file by delegating to {@link LeaderConfig#load(String)}.
     * <p>
     * Expected structure:
     * <pre>
     * consumerGroupId: g1
     * store:
     *   type: etcd
     *   endpoints: [http://127.0.0.1:2379]
     *   requestTimeoutSeconds: 30
     * leaderLeaseTtlSeconds: 15
     * barrierLeaseTtlSeconds: 10
     * selector: random
     * </pre>
     *
     * @throws IOException if the file cannot be read
     */
    public static LeaderConfig load(final String path) throws IOException {
        return LeaderConfig.load(path);
    }

    public static LeaderSettings settings(final LeaderConfig cfg) {
        return new LeaderSettings(cfg.getBarrierLeaseTtlSeconds());
    }

    public static ProducerSelector selector(final LeaderConfig cfg) {
        return ProducerSelector.named(cfg.getSelector());
    }
}
