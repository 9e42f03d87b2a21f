package io.snapshotd.dispatch;

import io.snapshotd.ErrorKind;
import io.snapshotd.SnapshotdException;
import io.snapshotd.spi.ExecutionResult;
import io.snapshotd.spi.MetricsExporter;
import io.snapshotd.spi.SnapshotTransaction;
import io.snapshotd.spi.TransactionPrimitives;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one Call/CallExt command on a worker thread and reports its outcome.
 *
 * <p>Never throws: every failure becomes an {@code Error} signal so the daemon stays
 * available for the next operation on the same transaction.
 */
final class CommandWorker implements Runnable {
    private static final Logger logger = Logger.getLogger(CommandWorker.class.getName());

    private final ExecutionContext context;
    private final TransactionPrimitives primitives;
    private final CommandLine commandLine;
    private final CompletionNotifier notifier;
    private final MetricsExporter metrics;

    CommandWorker(ExecutionContext context, TransactionPrimitives primitives, CommandLine commandLine,
            CompletionNotifier notifier, MetricsExporter metrics) {
        this.context = context;
        this.primitives = primitives;
        this.commandLine = commandLine;
        this.notifier = notifier;
        this.metrics = metrics;
    }

    @Override
    public void run() {
        String transactionId = context.transactionId();
        ExecutionResult result;
        try {
            context.signalStarted();
            metrics.incrementWorkerStarted();
            logger.info("Executing command `" + context.command() + "` in snapshot " + transactionId + "...");
            result = execute();
        } catch (SnapshotdException e) {
            if (e.kind() == ErrorKind.PRIMITIVE_FAILURE) {
                metrics.incrementPrimitiveFailure();
            }
            logger.warning("Command in snapshot " + transactionId + " failed: " + e.getMessage());
            notifier.commandFailed(transactionId, e.getMessage(), e.code());
            return;
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Unexpected failure running command in snapshot " + transactionId, t);
            notifier.commandFailed(transactionId, String.valueOf(t.getMessage()), -1);
            return;
        }
        notifier.commandExecuted(transactionId, result);
    }

    private ExecutionResult execute() throws SnapshotdException {
        List<String> argv = commandLine.expand(context.command());
        try (SnapshotTransaction transaction = primitives.create()) {
            transaction.resume(context.transactionId());
            ExecutionResult result = context.mode().run(transaction, argv);
            transaction.keep();
            return result;
        }
    }
}
