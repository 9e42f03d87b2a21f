package io.snapshotd.registry;

import io.snapshotd.ResourceExhaustedException;
import io.snapshotd.TransactionBusyException;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

/**
 * {@link ConcurrentHashMap}-backed transaction registry with an owner-thread guard.
 *
 * <p>The guard is consulted before every mutation; when it returns {@code false} the call
 * fails with {@link IllegalStateException}. The daemon passes
 * {@link io.snapshotd.loop.OwnerLoop#inOwnerThread()}, so worker threads can never change
 * registry state directly. Reads are lock-free and safe from any thread, which lets
 * metrics and shutdown checks observe the registry without going through the owner loop.
 */
public final class DefaultTransactionRegistry implements TransactionRegistry {
    private static final Logger logger = Logger.getLogger(DefaultTransactionRegistry.class.getName());

    private final Map<String, TransactionEntry> entries = new ConcurrentHashMap<>();
    private final BooleanSupplier ownerGuard;

    /**
     * Creates an unguarded registry. Callers are responsible for serializing mutations.
     */
    public DefaultTransactionRegistry() {
        this(() -> true);
    }

    /**
     * Creates a registry that only accepts mutations when {@code ownerGuard} returns true.
     *
     * @param ownerGuard tells whether the current thread may mutate the registry
     */
    public DefaultTransactionRegistry(BooleanSupplier ownerGuard) {
        this.ownerGuard = Objects.requireNonNull(ownerGuard, "ownerGuard");
    }

    @Override
    public TransactionEntry tryLock(String transactionId)
            throws TransactionBusyException, ResourceExhaustedException {
        Objects.requireNonNull(transactionId, "transactionId");
        checkOwner("tryLock");
        logger.info("Locking further invocations for snapshot " + transactionId + "...");

        TransactionEntry entry = null;
        TransactionEntry existing;
        try {
            entry = TransactionEntry.queued(transactionId);
            existing = entries.putIfAbsent(transactionId, entry);
        } catch (OutOfMemoryError e) {
            // a resize may fail after the node was linked in
            if (entry != null) {
                entries.remove(transactionId, entry);
            }
            throw new ResourceExhaustedException("Error while allocating space for transaction.", e);
        }
        if (existing != null) {
            throw new TransactionBusyException(transactionId);
        }
        return entry;
    }

    @Override
    public boolean unlock(String transactionId) {
        Objects.requireNonNull(transactionId, "transactionId");
        checkOwner("unlock");
        if (entries.remove(transactionId) == null) {
            logger.warning("Snapshot " + transactionId + " is not locked; nothing to unlock");
            return false;
        }
        logger.info("Unlocking snapshot " + transactionId + "...");
        return true;
    }

    @Override
    public boolean markRunning(String transactionId) {
        Objects.requireNonNull(transactionId, "transactionId");
        checkOwner("markRunning");
        return entries.computeIfPresent(transactionId, (id, entry) ->
                entry.state() == TransactionState.QUEUED ? entry.running() : entry) != null;
    }

    @Override
    public Optional<TransactionState> state(String transactionId) {
        TransactionEntry entry = entries.get(transactionId);
        return entry == null ? Optional.empty() : Optional.of(entry.state());
    }

    @Override
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public Set<String> lockedIds() {
        return Set.copyOf(entries.keySet());
    }

    private void checkOwner(String operation) {
        if (!ownerGuard.getAsBoolean()) {
            throw new IllegalStateException(operation + " called outside the owner thread: "
                    + Thread.currentThread().getName());
        }
    }
}
