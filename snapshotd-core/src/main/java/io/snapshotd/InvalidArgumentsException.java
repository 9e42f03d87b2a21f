package io.snapshotd;

/**
 * Thrown when a method call does not carry the expected string arguments.
 */
public final class InvalidArgumentsException extends SnapshotdException {

    public InvalidArgumentsException(String message) {
        super(ErrorKind.INVALID_ARGUMENTS, message, -1);
    }
}
