package io.snapshotd;

/**
 * Thrown when the registry cannot allocate room for a new lock. Nothing is inserted.
 */
public final class ResourceExhaustedException extends SnapshotdException {

    /** Mirrors {@code -ENOMEM}. */
    public static final int CODE = -12;

    public ResourceExhaustedException(String message, Throwable cause) {
        super(ErrorKind.RESOURCE_EXHAUSTED, message, CODE, cause);
    }
}
