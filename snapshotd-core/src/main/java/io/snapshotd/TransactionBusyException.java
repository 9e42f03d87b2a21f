package io.snapshotd;

/**
 * Thrown when a transaction id is already locked by an in-flight operation.
 */
public final class TransactionBusyException extends SnapshotdException {

    /** Mirrors {@code -EBUSY}. */
    public static final int CODE = -16;

    private final String transactionId;

    public TransactionBusyException(String transactionId) {
        super(ErrorKind.BUSY, "The transaction is currently in use by another thread.", CODE);
        this.transactionId = transactionId;
    }

    public String transactionId() {
        return transactionId;
    }
}
