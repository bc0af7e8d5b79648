package io.ringleader.store.model;

import java.util.Objects;

/**
 * Snapshot of one key as the store reported it.
 *
 * @param version 0 when the key does not exist, incremented on every put
 * @param leaseId 0 when the key is not attached to a lease
 */
public record KeyValue(String key, byte[] value, long createRevision, long modRevision, long version, long leaseId) {
    public KeyValue {
        Objects.requireNonNull(key, "key");
        value = value == null ? new byte[0] : value;
    }
}
