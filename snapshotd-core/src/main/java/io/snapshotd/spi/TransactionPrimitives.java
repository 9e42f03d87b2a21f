package io.snapshotd.spi;

import io.snapshotd.PrimitiveException;

/**
 * Entry point to the snapshot machinery. Every daemon operation creates a fresh
 * {@link SnapshotTransaction} handle, uses it, and closes it.
 *
 * <p>Implementations must allow {@link #create()} to be called concurrently from the owner
 * loop and from worker threads.
 */
@FunctionalInterface
public interface TransactionPrimitives {

    /**
     * Allocates a new, not yet initialized transaction handle.
     *
     * @return a handle the caller must close
     * @throws PrimitiveException if the handle cannot be allocated
     */
    SnapshotTransaction create() throws PrimitiveException;
}
