package io.snapshotd;

/**
 * Classification of failures reported to callers, either as an error reply or as an
 * asynchronous {@code Error} signal.
 */
public enum ErrorKind {
    /** Missing or malformed request parameters. */
    INVALID_ARGUMENTS,
    /** The transaction is already locked by another operation. */
    BUSY,
    /** The registry could not grow to hold a new lock. */
    RESOURCE_EXHAUSTED,
    /** The transaction primitives reported an error. */
    PRIMITIVE_FAILURE,
    /** The command string could not be expanded into an argument vector. */
    COMMAND_MALFORMED,
    /** The message bus could not be reached. */
    TRANSPORT_FAILURE
}
