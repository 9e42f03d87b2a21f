package io.snapshotd;

/**
 * Thrown by {@link io.snapshotd.spi.TransactionPrimitives} implementations when a snapshot
 * operation fails. The message is the collaborator's diagnostic and is passed to callers as is.
 */
public final class PrimitiveException extends SnapshotdException {

    public PrimitiveException(String message) {
        this(message, -1);
    }

    public PrimitiveException(String message, int code) {
        super(ErrorKind.PRIMITIVE_FAILURE, message, code);
    }

    public PrimitiveException(String message, int code, Throwable cause) {
        super(ErrorKind.PRIMITIVE_FAILURE, message, code, cause);
    }
}
