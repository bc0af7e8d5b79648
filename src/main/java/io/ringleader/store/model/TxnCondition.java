package io.ringleader.store.model;

import java.util.Objects;

/**
 * One compare clause of a guarded transaction. A missing key compares with
 * version 0 and mod revision 0.
 */
public record TxnCondition(String key, Target target, Op op, long operand) {
    public enum Target { VERSION, MOD_REVISION }

    public enum Op { EQUAL, GREATER, LESS }

    public TxnCondition {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(op, "op");
    }

    public static TxnCondition versionGreater(final String key, final long version) {
        return new TxnCondition(key, Target.VERSION, Op.GREATER, version);
    }

    public static TxnCondition versionEquals(final String key, final long version) {
        return new TxnCondition(key, Target.VERSION, Op.EQUAL, version);
    }

    public static TxnCondition modRevisionEquals(final String key, final long revision) {
        return new TxnCondition(key, Target.MOD_REVISION, Op.EQUAL, revision);
    }

    public boolean test(final KeyValue current) {
        final long actual = current == null ? 0L
                : (target == Target.VERSION ? current.version() : current.modRevision());
        return switch (op) {
            case EQUAL -> actual == operand;
            case GREATER -> actual > operand;
            case LESS -> actual < operand;
        };
    }
}
