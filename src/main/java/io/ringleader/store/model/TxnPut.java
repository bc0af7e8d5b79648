package io.ringleader.store.model;

import java.util.Objects;

/**
 * @param leaseId 0 for a key without a lease
 */
public record TxnPut(String key, byte[] value, long leaseId) {
    public TxnPut {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public static TxnPut of(final String key, final byte[] value) {
        return new TxnPut(key, value, 0L);
    }
}
