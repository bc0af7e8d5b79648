package io.ringleader.store.model;

/**
 * Outcome of a guarded transaction.
 *
 * @param succeeded whether every condition held and the puts were applied
 * @param revision  store revision after the transaction; the write revision when succeeded
 */
public record TxnResult(boolean succeeded, long revision) {
}
