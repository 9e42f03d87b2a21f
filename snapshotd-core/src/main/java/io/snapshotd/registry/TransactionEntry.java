package io.snapshotd.registry;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable registry record for one locked transaction.
 *
 * @param transactionId the locked transaction id
 * @param state         current lifecycle state
 * @param lockedAt      when the lock was acquired
 */
public record TransactionEntry(String transactionId, TransactionState state, Instant lockedAt) {

    public TransactionEntry {
        Objects.requireNonNull(transactionId, "transactionId");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(lockedAt, "lockedAt");
    }

    static TransactionEntry queued(String transactionId) {
        return new TransactionEntry(transactionId, TransactionState.QUEUED, Instant.now());
    }

    TransactionEntry running() {
        return new TransactionEntry(transactionId, TransactionState.RUNNING, lockedAt);
    }
}
