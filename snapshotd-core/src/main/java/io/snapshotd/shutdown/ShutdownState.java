package io.snapshotd.shutdown;

/**
 * Lifecycle of a daemon with respect to termination requests.
 */
public enum ShutdownState {
    /** No termination requested. */
    RUNNING,
    /** Termination requested; waiting for locked transactions to be released. */
    DRAINING,
    /** The owner loop has been stopped. */
    TERMINATED
}
