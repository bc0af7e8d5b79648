package io.ringleader.store.model;

public record WatchEvent(Type type, KeyValue keyValue, long revision) {
    public enum Type { PUT, DELETE }

    public String key() {
        return keyValue.key();
    }
}
