package io.ringleader.model;

import java.util.Objects;

public record ProducerId(String value) implements Comparable<ProducerId> {
    public ProducerId(final String value) {
        Objects.requireNonNull(value, "value");
        if (value.isBlank() || value.indexOf('/') >= 0) {
            throw new IllegalArgumentException("producer id must be non-blank and contain no '/': " + value);
        }
        this.value = value;
    }

    @Override
    public int compareTo(final ProducerId o) {
        return value.compareTo(o.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
