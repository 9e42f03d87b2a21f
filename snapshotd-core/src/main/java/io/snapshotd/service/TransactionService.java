package io.snapshotd.service;

import io.snapshotd.DaemonConfig;
import io.snapshotd.ErrorKind;
import io.snapshotd.InvalidArgumentsException;
import io.snapshotd.PrimitiveException;
import io.snapshotd.ResourceExhaustedException;
import io.snapshotd.SnapshotdException;
import io.snapshotd.TransactionBusyException;
import io.snapshotd.TransportException;
import io.snapshotd.bus.BusSignal;
import io.snapshotd.bus.MethodCall;
import io.snapshotd.bus.MethodHandler;
import io.snapshotd.bus.SignalPublisher;
import io.snapshotd.dispatch.ExecutionDispatcher;
import io.snapshotd.dispatch.ExecutionMode;
import io.snapshotd.registry.TransactionRegistry;
import io.snapshotd.shutdown.ShutdownState;
import io.snapshotd.spi.MetricsExporter;
import io.snapshotd.spi.SnapshotTransaction;
import io.snapshotd.spi.TransactionPrimitives;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handlers for the five transaction methods. Every handler must run on the owner loop.
 *
 * <ul>
 *   <li>{@code Open(base)}: creates a transaction, emits {@code TransactionOpened}, replies
 *       with the new snapshot id. Takes no lock.</li>
 *   <li>{@code Call} / {@code CallExt(transaction, command)}: locks, starts a worker, replies
 *       once the worker is running. The command's result arrives later as a signal.</li>
 *   <li>{@code Close} / {@code Abort(transaction)}: locks, finalizes or discards the
 *       transaction, replies with a return code, unlocks.</li>
 * </ul>
 *
 * <p>Errors raised before a reply are answered with the configured error name and the
 * failure's message. Once the daemon has terminated every method is refused; while it
 * drains only {@code Open}, {@code Call} and {@code CallExt} are, and only when
 * {@link DaemonConfig#isRejectWhileDraining()} is set.
 */
public final class TransactionService {
    private static final Logger logger = Logger.getLogger(TransactionService.class.getName());

    public static final String OPEN = "Open";
    public static final String CALL = "Call";
    public static final String CALL_EXT = "CallExt";
    public static final String CLOSE = "Close";
    public static final String ABORT = "Abort";

    static final String BAD_PARAMETERS = "Could not read D-Bus parameters.";
    static final String BAD_BASE = "Could not read base snapshot identifier.";
    static final String OPENED_SIGNAL_FAILED = "Sending signal 'TransactionOpened' failed.";
    static final String SHUTTING_DOWN = "The daemon is shutting down.";
    static final String NO_SNAPSHOT_ID = "Could not determine snapshot identifier.";
    static final String WORKER_NOT_STARTED = "Could not start a worker for the transaction.";

    private final DaemonConfig config;
    private final TransactionRegistry registry;
    private final TransactionPrimitives primitives;
    private final SignalPublisher publisher;
    private final ExecutionDispatcher dispatcher;
    private final MetricsExporter metrics;
    private final Supplier<ShutdownState> shutdownState;

    public TransactionService(DaemonConfig config, TransactionRegistry registry, TransactionPrimitives primitives,
            SignalPublisher publisher, ExecutionDispatcher dispatcher, MetricsExporter metrics,
            Supplier<ShutdownState> shutdownState) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.primitives = Objects.requireNonNull(primitives, "primitives");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
        this.shutdownState = Objects.requireNonNull(shutdownState, "shutdownState");
    }

    /**
     * Returns the handlers keyed by method name, in protocol order.
     *
     * @return method handlers
     */
    public Map<String, MethodHandler> handlers() {
        Map<String, MethodHandler> handlers = new LinkedHashMap<>();
        handlers.put(OPEN, this::open);
        handlers.put(CALL, call -> call(call, ExecutionMode.CHROOTED));
        handlers.put(CALL_EXT, call -> call(call, ExecutionMode.EXTERNAL));
        handlers.put(CLOSE, call -> finish(call, true));
        handlers.put(ABORT, call -> finish(call, false));
        return handlers;
    }

    public void open(MethodCall call) {
        if (refuse(call, true)) {
            return;
        }
        String snapshotId;
        try {
            String base = call.stringArgument(0, BAD_BASE);
            try (SnapshotTransaction transaction = primitives.create()) {
                transaction.init(base);
                snapshotId = transaction.snapshotId();
                if (snapshotId == null) {
                    throw new PrimitiveException(NO_SNAPSHOT_ID);
                }
                transaction.keep();
            }
        } catch (SnapshotdException e) {
            fail(call, OPEN, e);
            return;
        } catch (RuntimeException e) {
            unexpected(call, OPEN, e);
            return;
        }

        try {
            publisher.publish(new BusSignal.TransactionOpened(snapshotId));
        } catch (TransportException | RuntimeException e) {
            logger.log(Level.SEVERE, "Cannot send signal 'TransactionOpened' for snapshot " + snapshotId, e);
            call.replyError(config.getErrorName(), OPENED_SIGNAL_FAILED);
            return;
        }
        metrics.incrementTransactionOpened();
        logger.info("Snapshot " + snapshotId + " created.");
        call.reply(snapshotId);
    }

    /**
     * Handles {@code Call} and {@code CallExt}. The reply is deferred until the worker runs.
     *
     * @param call the method call
     * @param mode chrooted for {@code Call}, external for {@code CallExt}
     */
    public void call(MethodCall call, ExecutionMode mode) {
        if (refuse(call, true)) {
            return;
        }
        String transactionId;
        String command;
        try {
            transactionId = call.stringArgument(0, BAD_PARAMETERS);
            command = call.stringArgument(1, BAD_PARAMETERS);
            lock(transactionId);
        } catch (SnapshotdException e) {
            fail(call, call.member(), e);
            return;
        }

        try {
            dispatcher.dispatch(transactionId, command, mode, () -> call.reply());
        } catch (RejectedExecutionException e) {
            logger.warning("Cannot start worker for snapshot " + transactionId + ": " + e.getMessage());
            release(transactionId);
            call.replyError(config.getErrorName(), SHUTTING_DOWN);
        } catch (OutOfMemoryError e) {
            logger.log(Level.SEVERE, "Cannot start worker for snapshot " + transactionId, e);
            release(transactionId);
            fail(call, call.member(), new ResourceExhaustedException(WORKER_NOT_STARTED, e));
        } catch (RuntimeException e) {
            release(transactionId);
            unexpected(call, call.member(), e);
        }
    }

    /**
     * Handles {@code Close} (finalize) and {@code Abort} (discard). The lock is released on
     * every path once acquired.
     *
     * @param call     the method call
     * @param finalize {@code true} for {@code Close}
     */
    public void finish(MethodCall call, boolean finalize) {
        if (refuse(call, false)) {
            return;
        }
        String member = finalize ? CLOSE : ABORT;
        String transactionId;
        try {
            transactionId = call.stringArgument(0, BAD_PARAMETERS);
            lock(transactionId);
        } catch (SnapshotdException e) {
            fail(call, member, e);
            return;
        }

        try (SnapshotTransaction transaction = primitives.create()) {
            transaction.resume(transactionId);
            if (finalize) {
                transaction.finalizeSnapshot();
                metrics.incrementTransactionClosed();
                logger.info("Snapshot " + transactionId + " closed.");
            } else {
                metrics.incrementTransactionAborted();
                logger.info("Snapshot " + transactionId + " aborted.");
            }
            call.reply(0);
        } catch (SnapshotdException e) {
            fail(call, member, e);
        } catch (RuntimeException e) {
            unexpected(call, member, e);
        } finally {
            release(transactionId);
        }
    }

    private void lock(String transactionId) throws SnapshotdException {
        try {
            registry.tryLock(transactionId);
        } catch (TransactionBusyException e) {
            metrics.incrementLockBusy();
            throw e;
        }
        metrics.incrementLockAcquired();
        metrics.recordLockedTransactions(registry.size());
    }

    private void release(String transactionId) {
        registry.unlock(transactionId);
        metrics.recordLockedTransactions(registry.size());
    }

    private boolean refuse(MethodCall call, boolean startsWork) {
        ShutdownState state = shutdownState.get();
        if (state == ShutdownState.TERMINATED) {
            logger.warning("Rejecting " + call.member() + ": daemon has terminated");
        } else if (state == ShutdownState.DRAINING && startsWork && config.isRejectWhileDraining()) {
            logger.warning("Rejecting " + call.member() + ": shutdown in progress");
        } else {
            return false;
        }
        call.replyError(config.getErrorName(), SHUTTING_DOWN);
        return true;
    }

    private void fail(MethodCall call, String member, SnapshotdException e) {
        if (e instanceof InvalidArgumentsException || e instanceof TransactionBusyException) {
            logger.warning(member + " rejected: " + e.getMessage());
        } else {
            logger.warning(member + " failed: " + e.getMessage());
            if (e.kind() == ErrorKind.PRIMITIVE_FAILURE) {
                metrics.incrementPrimitiveFailure();
            }
        }
        call.replyError(config.getErrorName(), e.getMessage());
    }

    private void unexpected(MethodCall call, String member, RuntimeException e) {
        logger.log(Level.SEVERE, "Unexpected failure in " + member, e);
        call.replyError(config.getErrorName(), String.valueOf(e.getMessage()));
    }
}
