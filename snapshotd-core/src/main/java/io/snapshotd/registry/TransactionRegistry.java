package io.snapshotd.registry;

import io.snapshotd.ResourceExhaustedException;
import io.snapshotd.TransactionBusyException;

import java.util.Optional;
import java.util.Set;

/**
 * Set of transaction ids currently owned by an in-flight operation.
 *
 * <p>An id is present if and only if some operation holds exclusive rights on that
 * transaction. Locking is keyed purely by id; distinct ids never contend with each other.
 *
 * <p>Mutating methods ({@link #tryLock}, {@link #unlock}, {@link #markRunning}) must only be
 * called from the daemon's owner loop. Read methods may be called from any thread.
 *
 * @see DefaultTransactionRegistry
 */
public interface TransactionRegistry {

    /**
     * Locks the given transaction id, inserting a {@link TransactionState#QUEUED} entry.
     *
     * @param transactionId the id to lock
     * @return the inserted entry
     * @throws TransactionBusyException   if the id is already locked; nothing is changed
     * @throws ResourceExhaustedException if no room could be allocated; nothing is inserted
     */
    TransactionEntry tryLock(String transactionId)
            throws TransactionBusyException, ResourceExhaustedException;

    /**
     * Removes the entry for the given id. Unlocking an id that is not locked is a no-op.
     *
     * @param transactionId the id to unlock
     * @return {@code true} if an entry was removed
     */
    boolean unlock(String transactionId);

    /**
     * Transitions a {@link TransactionState#QUEUED} entry to {@link TransactionState#RUNNING}.
     *
     * @param transactionId the id whose worker has started
     * @return {@code true} if an entry exists for the id
     */
    boolean markRunning(String transactionId);

    /**
     * Returns the state of the given id, or empty if it is not locked.
     *
     * @param transactionId the id to look up
     * @return the current state, if locked
     */
    Optional<TransactionState> state(String transactionId);

    boolean isEmpty();

    int size();

    /**
     * Returns a point-in-time copy of the locked ids.
     *
     * @return locked ids, in no particular order
     */
    Set<String> lockedIds();
}
