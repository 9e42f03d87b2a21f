package io.snapshotd.dispatch;

import io.snapshotd.spi.MetricsExporter;
import io.snapshotd.spi.TransactionPrimitives;
import io.snapshotd.util.NamedThreadFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Starts one worker per accepted Call/CallExt request.
 *
 * <p>The caller (a request handler on the owner loop) must already hold the transaction's
 * lock. {@link #dispatch} returns as soon as the worker is submitted; the worker's start
 * notification later runs {@code onRunning} on the owner loop, which is where the method
 * call gets answered. The command's outcome is reported through {@link CompletionNotifier}.
 *
 * <p>Workers run on an unbounded pool of named daemon threads; concurrency is limited only
 * by the number of distinct locked transactions.
 */
public final class ExecutionDispatcher implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ExecutionDispatcher.class.getName());

    private final ExecutorService workers;
    private final TransactionPrimitives primitives;
    private final CommandLine commandLine;
    private final CompletionNotifier notifier;
    private final MetricsExporter metrics;
    private final AtomicInteger activeWorkers = new AtomicInteger();

    public ExecutionDispatcher(TransactionPrimitives primitives, CommandLine commandLine,
            CompletionNotifier notifier, MetricsExporter metrics) {
        this(primitives, commandLine, notifier, metrics,
                Executors.newCachedThreadPool(new NamedThreadFactory("snapshotd-worker-")));
    }

    /**
     * Creates a dispatcher running workers on {@code workers}, which it shuts down on
     * {@link #close()}.
     */
    public ExecutionDispatcher(TransactionPrimitives primitives, CommandLine commandLine,
            CompletionNotifier notifier, MetricsExporter metrics, ExecutorService workers) {
        this.primitives = Objects.requireNonNull(primitives, "primitives");
        this.commandLine = Objects.requireNonNull(commandLine, "commandLine");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
        this.workers = Objects.requireNonNull(workers, "workers");
    }

    /**
     * Starts a worker for a locked transaction.
     *
     * @param transactionId the locked transaction
     * @param command       the unexpanded command string
     * @param mode          chrooted or external execution
     * @param onRunning     run on the owner loop once the worker has started
     * @throws RejectedExecutionException if the dispatcher has been closed
     * @throws OutOfMemoryError if no thread can be created for the worker
     */
    public void dispatch(String transactionId, String command, ExecutionMode mode, Runnable onRunning) {
        Objects.requireNonNull(onRunning, "onRunning");
        ExecutionContext context = new ExecutionContext(transactionId, command, mode,
                () -> notifier.workerStarted(transactionId, onRunning));
        CommandWorker worker = new CommandWorker(context, primitives, commandLine, notifier, metrics);

        activeWorkers.incrementAndGet();
        try {
            workers.execute(() -> {
                try {
                    worker.run();
                } finally {
                    activeWorkers.decrementAndGet();
                }
            });
        } catch (RuntimeException | Error e) {
            activeWorkers.decrementAndGet();
            throw e;
        }
    }

    /**
     * Returns the number of workers that have been submitted and not yet finished.
     *
     * @return active worker count
     */
    public int activeWorkers() {
        return activeWorkers.get();
    }

    /**
     * Stops accepting workers and waits briefly for running ones. Workers still running
     * after that are interrupted.
     */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warning("Workers still running after 5s: " + activeWorkers.get() + "; interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
