package io.ringleader.model;

import java.util.Objects;

/**
 * Opaque consumer group identifier. Scopes every key the leader touches.
 */
public record ConsumerGroupId(String value) {
    public ConsumerGroupId(final String value) {
        Objects.requireNonNull(value, "value");
        if (value.isBlank() || value.indexOf('/') >= 0) {
            throw new IllegalArgumentException("consumer group id must be non-blank and contain no '/': " + value);
        }
        this.value = value;
    }

    @Override
    public String toString() {
        return value;
    }
}
