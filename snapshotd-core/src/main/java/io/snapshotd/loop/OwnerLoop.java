package io.snapshotd.loop;

import io.snapshotd.util.NamedThreadFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded FIFO task loop that owns all registry state.
 *
 * <p>Request handlers, worker notifications and shutdown checks are all posted here and
 * run one at a time on the owner thread, so anything confined to this loop needs no
 * further synchronization. Tasks that throw are logged and do not stop the loop.
 *
 * <p>This class is thread-safe; {@link #execute}, {@link #schedule} and {@link #submit} may
 * be called from any thread.
 */
public final class OwnerLoop implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(OwnerLoop.class.getName());

    private final ScheduledThreadPoolExecutor executor;
    private volatile Thread ownerThread;

    public OwnerLoop() {
        this("snapshotd-owner-");
    }

    public OwnerLoop(String threadPrefix) {
        NamedThreadFactory factory = new NamedThreadFactory(threadPrefix);
        this.executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = factory.newThread(runnable);
            ownerThread = thread;
            return thread;
        });
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);
    }

    /**
     * Posts a task to run on the owner thread after all previously posted tasks.
     *
     * @param task the task to run
     * @throws RejectedExecutionException if the loop has been stopped
     */
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        executor.execute(() -> runGuarded(task));
    }

    /**
     * Posts a task to run on the owner thread after the given delay.
     *
     * @param task    the task to run
     * @param delayMs delay in milliseconds
     * @return a handle that can cancel the task
     * @throws RejectedExecutionException if the loop has been stopped
     */
    public ScheduledFuture<?> schedule(Runnable task, long delayMs) {
        Objects.requireNonNull(task, "task");
        return executor.schedule(() -> runGuarded(task), delayMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Runs {@code action} on the owner thread and returns its result asynchronously.
     *
     * @param action the action to run
     * @param <T>    result type
     * @return a future completed with the action's result or failure
     */
    public <T> CompletableFuture<T> submit(Supplier<T> action) {
        Objects.requireNonNull(action, "action");
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            execute(() -> {
                try {
                    result.complete(action.get());
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Tells whether the calling thread is the owner thread.
     *
     * @return {@code true} when called from a task running on this loop
     */
    public boolean inOwnerThread() {
        return Thread.currentThread() == ownerThread;
    }

    boolean isStopped() {
        return executor.isShutdown();
    }

    /**
     * Stops accepting tasks. Tasks already posted without delay still run; delayed tasks
     * are dropped. Safe to call from the owner thread itself.
     */
    public void stop() {
        executor.shutdown();
    }

    /**
     * Waits for the loop to finish its remaining tasks after {@link #stop()}.
     *
     * @param timeout maximum time to wait
     * @param unit    unit of {@code timeout}
     * @return {@code true} if the loop terminated
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitStopped(long timeout, TimeUnit unit) throws InterruptedException {
        return executor.awaitTermination(timeout, unit);
    }

    @Override
    public void close() {
        stop();
        if (inOwnerThread()) {
            return;
        }
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warning("Owner loop did not stop within 5s; interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static void runGuarded(Runnable task) {
        try {
            task.run();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Owner loop task failed", t);
        }
    }
}
