package io.ringleader.store.model;

import java.util.List;

/**
 * Keys under a prefix as of {@code revision}. Watching from {@code revision + 1}
 * continues exactly where the scan stopped.
 *
 * @param keyValues matching keys, ordered by key
 */
public record PrefixScan(List<KeyValue> keyValues, long revision) {
    public PrefixScan {
        keyValues = List.copyOf(keyValues);
    }

    public long nextRevision() {
        return revision + 1;
    }
}
