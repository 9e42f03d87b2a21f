package io.snapshotd.spi;

import io.snapshotd.PrimitiveException;

import java.util.List;

/**
 * Handle on one snapshot transaction.
 *
 * <p>A handle is either initialized from a base snapshot with {@link #init} or attached to
 * an existing transaction with {@link #resume}. Closing a handle whose transaction was
 * neither {@linkplain #keep() kept} nor {@linkplain #finalizeSnapshot() finalized} discards
 * the transaction.
 */
public interface SnapshotTransaction extends AutoCloseable {

    /**
     * Creates a new transaction branched from {@code baseSnapshot}.
     *
     * @param baseSnapshot base snapshot id, e.g. {@code "default"} or a number
     * @throws PrimitiveException if the base is invalid or the snapshot cannot be created
     */
    void init(String baseSnapshot) throws PrimitiveException;

    /**
     * Attaches this handle to an existing transaction.
     *
     * @param transactionId the transaction (snapshot) id
     * @throws PrimitiveException if no such transaction can be resumed
     */
    void resume(String transactionId) throws PrimitiveException;

    /**
     * Returns the id of the snapshot backing this transaction.
     *
     * @return snapshot id
     * @throws PrimitiveException if the handle is not initialized
     */
    String snapshotId() throws PrimitiveException;

    /**
     * Marks the transaction persistent so it survives {@link #close()}.
     *
     * @throws PrimitiveException on failure
     */
    void keep() throws PrimitiveException;

    /**
     * Runs a command with its root changed into the transaction's snapshot.
     *
     * @param argv command and arguments
     * @return return code and captured output
     * @throws PrimitiveException if the command cannot be started
     */
    ExecutionResult execute(List<String> argv) throws PrimitiveException;

    /**
     * Runs a command in the caller's root with the transaction as context.
     *
     * @param argv command and arguments
     * @return return code and captured output
     * @throws PrimitiveException if the command cannot be started
     */
    ExecutionResult callExternal(List<String> argv) throws PrimitiveException;

    /**
     * Commits the transaction permanently.
     *
     * @throws PrimitiveException on failure
     */
    void finalizeSnapshot() throws PrimitiveException;

    /**
     * Releases the handle.
     */
    @Override
    void close();
}
