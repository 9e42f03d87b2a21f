package io.snapshotd.registry;

/**
 * Lifecycle of a locked transaction. A finished transaction has no entry at all.
 */
public enum TransactionState {
    /** Lock acquired, no worker has started yet. */
    QUEUED,
    /** A Call/CallExt worker has started executing. */
    RUNNING
}
