package io.snapshotd;

/**
 * Thrown when a command string cannot be expanded into an argument vector.
 *
 * <p>The code follows the POSIX {@code wordexp} return values ({@link #BAD_CHARACTER},
 * {@link #COMMAND_SUBSTITUTION}, {@link #SYNTAX}).
 */
public final class CommandMalformedException extends SnapshotdException {

    public static final int BAD_CHARACTER = 2;
    public static final int COMMAND_SUBSTITUTION = 4;
    public static final int SYNTAX = 5;

    public CommandMalformedException(int code) {
        super(ErrorKind.COMMAND_MALFORMED, "Command could not be processed.", code);
    }
}
