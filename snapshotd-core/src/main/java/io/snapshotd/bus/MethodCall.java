package io.snapshotd.bus;

import io.snapshotd.InvalidArgumentsException;

import java.util.List;

/**
 * An incoming method call. Each call is answered exactly once, either with
 * {@link #reply} or with {@link #replyError}.
 */
public interface MethodCall {

    String member();

    List<Object> arguments();

    /**
     * Sends a successful reply.
     *
     * @param values reply values in wire order; empty for methods without a result
     * @throws IllegalStateException if the call was already answered
     */
    void reply(Object... values);

    /**
     * Sends an error reply.
     *
     * @param errorName bus error name
     * @param message   human-readable diagnostic
     * @throws IllegalStateException if the call was already answered
     */
    void replyError(String errorName, String message);

    /**
     * Reads a string argument.
     *
     * @param index        argument position
     * @param errorMessage message of the exception thrown when the argument is missing
     * @return the argument value
     * @throws InvalidArgumentsException if the argument is missing or not a string
     */
    default String stringArgument(int index, String errorMessage) throws InvalidArgumentsException {
        List<Object> args = arguments();
        if (args == null || index >= args.size() || !(args.get(index) instanceof String value)) {
            throw new InvalidArgumentsException(errorMessage);
        }
        return value;
    }
}
