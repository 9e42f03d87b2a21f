package io.snapshotd.spi;

/**
 * Observability hook for exporting daemon counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. Implementations are called from the
 * owner loop and from worker threads and must be thread-safe.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of successful lock acquisitions.
     */
    void incrementLockAcquired();

    /**
     * Increments the count of requests rejected because the transaction was locked.
     */
    void incrementLockBusy();

    void incrementTransactionOpened();

    void incrementTransactionClosed();

    void incrementTransactionAborted();

    /**
     * Increments the count of commands that ran and reported a return code.
     */
    void incrementCommandExecuted();

    /**
     * Increments the count of commands that ended with an {@code Error} signal.
     */
    void incrementCommandFailed();

    /**
     * Increments the count of failures reported by the transaction primitives.
     */
    default void incrementPrimitiveFailure() {
    }

    /**
     * Increments the count of command workers started.
     */
    default void incrementWorkerStarted() {
    }

    /**
     * Records the number of currently locked transactions.
     *
     * @param count registry size
     */
    void recordLockedTransactions(int count);

    /**
     * Default no-op implementation.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementLockAcquired() {
        }

        @Override
        public void incrementLockBusy() {
        }

        @Override
        public void incrementTransactionOpened() {
        }

        @Override
        public void incrementTransactionClosed() {
        }

        @Override
        public void incrementTransactionAborted() {
        }

        @Override
        public void incrementCommandExecuted() {
        }

        @Override
        public void incrementCommandFailed() {
        }

        @Override
        public void recordLockedTransactions(int count) {
        }
    }
}
