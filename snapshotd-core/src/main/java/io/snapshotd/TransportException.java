package io.snapshotd;

/**
 * Thrown by {@link io.snapshotd.bus.MessageBus} implementations when the bus cannot be reached.
 */
public final class TransportException extends SnapshotdException {

    public TransportException(String message) {
        super(ErrorKind.TRANSPORT_FAILURE, message, -1);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT_FAILURE, message, -1, cause);
    }
}
