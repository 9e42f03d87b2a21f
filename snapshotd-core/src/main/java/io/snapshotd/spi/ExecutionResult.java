package io.snapshotd.spi;

/**
 * Outcome of a command run inside a transaction.
 *
 * @param returnCode the command's exit status
 * @param output     captured output, never null
 */
public record ExecutionResult(int returnCode, String output) {

    public ExecutionResult {
        output = output == null ? "" : output;
    }
}
