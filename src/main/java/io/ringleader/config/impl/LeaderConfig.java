package io.ringleader.config.impl;

import lombok.Getter;
import lombok.ToString;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Immutable config holder loaded from leader.yaml
 */
@Getter
@ToString
public final class LeaderConfig {

    public enum StoreType { ETCD, MEMORY }

    private String consumerGroupId;
    private StoreType storeType;
    private List<String> endpoints;
    private long requestTimeoutSeconds;
    private long leaderLeaseTtlSeconds;
    private long barrierLeaseTtlSeconds;
    private String selector;

    public static LeaderConfig load(final String path) throws IOException {
        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            return load(in);
        }
    }

    @SuppressWarnings("unchecked")
    public static LeaderConfig load(final InputStream in) {
        final Map<String, Object> m = new Yaml().load(in);
        if (m == null) throw new IllegalArgumentException("empty leader configuration");
        final LeaderConfig cfg = new LeaderConfig();

        cfg.consumerGroupId = (String) m.get("consumerGroupId");
        if (cfg.consumerGroupId == null) throw new IllegalArgumentException("consumerGroupId is required");

        final Map<String, Object> store = (Map<String, Object>) m.getOrDefault("store", Map.of());
        cfg.storeType             = StoreType.valueOf(((String) store.getOrDefault("type", "etcd")).toUpperCase());
        cfg.endpoints             = List.copyOf((List<String>) store.getOrDefault("endpoints", List.of("http://127.0.0.1:2379")));
        cfg.requestTimeoutSeconds = number(store, "requestTimeoutSeconds", 30);

        cfg.leaderLeaseTtlSeconds  = number(m, "leaderLeaseTtlSeconds", 15);
        cfg.barrierLeaseTtlSeconds = number(m, "barrierLeaseTtlSeconds", 10);
        cfg.selector               = (String) m.getOrDefault("selector", "random");

        if (cfg.storeType == StoreType.ETCD && cfg.endpoints.isEmpty()) {
            throw new IllegalArgumentException("store.endpoints must not be empty for an etcd store");
        }
        return cfg;
    }

    private static long number(final Map<String, Object> m, final String key, final long fallback) {
        final Object v = m.get(key);
        if (v == null) return fallback;
        final long n = ((Number) v).longValue();
        if (n <= 0) throw new IllegalArgumentException(key + " must be > 0, got " + n);
        return n;
    }
}
