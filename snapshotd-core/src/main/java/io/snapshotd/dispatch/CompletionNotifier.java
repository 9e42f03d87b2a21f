package io.snapshotd.dispatch;

import io.snapshotd.TransportException;
import io.snapshotd.bus.BusSignal;
import io.snapshotd.bus.SignalListener;
import io.snapshotd.bus.SignalPublisher;
import io.snapshotd.loop.OwnerLoop;
import io.snapshotd.registry.TransactionRegistry;
import io.snapshotd.spi.ExecutionResult;
import io.snapshotd.spi.MetricsExporter;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes worker progress back to the owner loop and reports command outcomes on the bus.
 *
 * <p>Workers call into this class from their own threads. Signals are emitted directly
 * from the worker thread; every registry change (marking a transaction running, releasing
 * its lock) is posted to the {@link OwnerLoop} instead of being applied in place.
 *
 * <p>By default the lock is released through that private path right after the outcome
 * signal has been emitted. In broadcast mode the lock is instead released when the
 * daemon's own subscription observes the signal ({@link #onSignal}); if no signal could be
 * emitted at all the private path is used anyway so the transaction does not stay locked.
 */
public final class CompletionNotifier implements SignalListener {
    private static final Logger logger = Logger.getLogger(CompletionNotifier.class.getName());

    private final OwnerLoop ownerLoop;
    private final TransactionRegistry registry;
    private final SignalPublisher publisher;
    private final MetricsExporter metrics;
    private final boolean unlockOnBroadcast;

    public CompletionNotifier(OwnerLoop ownerLoop, TransactionRegistry registry, SignalPublisher publisher,
            MetricsExporter metrics, boolean unlockOnBroadcast) {
        this.ownerLoop = Objects.requireNonNull(ownerLoop, "ownerLoop");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
        this.unlockOnBroadcast = unlockOnBroadcast;
    }

    /**
     * Marks the transaction running on the owner loop, then runs {@code onRunning} there.
     *
     * @param transactionId the transaction whose worker started
     * @param onRunning     continuation run on the owner thread after the transition, or on
     *                      the calling thread once the owner loop has stopped
     */
    public void workerStarted(String transactionId, Runnable onRunning) {
        boolean posted = post(transactionId, () -> {
            if (!registry.markRunning(transactionId)) {
                logger.warning("Worker started for snapshot " + transactionId + " which is not locked");
            }
            onRunning.run();
        });
        if (!posted) {
            // the registry is gone with the loop, but the caller still waits for its answer
            onRunning.run();
        }
    }

    /**
     * Reports a finished command with {@code CommandExecuted} and releases the lock.
     *
     * @param transactionId the transaction the command ran in
     * @param result        return code and output
     */
    public void commandExecuted(String transactionId, ExecutionResult result) {
        boolean reported = false;
        try {
            publisher.publish(new BusSignal.CommandExecuted(transactionId, result.returnCode(), result.output()));
            reported = true;
            metrics.incrementCommandExecuted();
        } catch (TransportException | RuntimeException e) {
            if (!reported) {
                logger.log(Level.SEVERE, "Cannot send signal 'CommandExecuted' for snapshot " + transactionId, e);
                reported = reportError(transactionId, "Cannot send signal 'CommandExecuted'.",
                        e instanceof TransportException t ? t.code() : -1);
            } else {
                logger.log(Level.WARNING, "Metrics update failed for snapshot " + transactionId, e);
            }
        } finally {
            finish(transactionId, reported);
        }
    }

    /**
     * Reports a failed command with an {@code Error} signal and releases the lock.
     *
     * @param transactionId the transaction the command was meant to run in
     * @param message       diagnostic for the caller
     * @param code          failure code
     */
    public void commandFailed(String transactionId, String message, int code) {
        finish(transactionId, reportError(transactionId, message, code));
    }

    /**
     * Releases the lock of the transaction named by a signal seen on the signal path.
     * Only subscribed in broadcast mode.
     */
    @Override
    public void onSignal(String interfaceName, BusSignal signal) {
        release(signal.transactionId());
    }

    // never throws; false means no signal left the daemon
    private boolean reportError(String transactionId, String message, int code) {
        try {
            metrics.incrementCommandFailed();
            publisher.publish(new BusSignal.ExecutionError(transactionId, message, code));
            return true;
        } catch (TransportException | RuntimeException e) {
            logger.log(Level.SEVERE, "Cannot reach the message bus any more; error for snapshot "
                    + transactionId + " was: " + message, e);
            return false;
        }
    }

    private void finish(String transactionId, boolean reported) {
        if (unlockOnBroadcast && reported) {
            return;
        }
        release(transactionId);
    }

    private void release(String transactionId) {
        post(transactionId, () -> {
            registry.unlock(transactionId);
            metrics.recordLockedTransactions(registry.size());
        });
    }

    private boolean post(String transactionId, Runnable task) {
        try {
            ownerLoop.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            logger.warning("Owner loop is stopped; dropping update for snapshot " + transactionId);
            return false;
        }
    }
}
