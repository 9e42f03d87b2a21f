package io.snapshotd;

import java.util.Objects;

/**
 * Base class for every failure the daemon reports back to a caller.
 *
 * <p>Carries an {@link ErrorKind} and the numeric code that is sent along with
 * {@code Error} signals. The message is the human-readable diagnostic placed in error replies.
 */
public class SnapshotdException extends Exception {

    private final ErrorKind kind;
    private final int code;

    public SnapshotdException(ErrorKind kind, String message, int code) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.code = code;
    }

    public SnapshotdException(ErrorKind kind, String message, int code, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.code = code;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Returns the numeric code reported with this failure.
     *
     * @return a negative errno-style value for locking failures, otherwise the code
     *     reported by the collaborator
     */
    public int code() {
        return code;
    }
}
