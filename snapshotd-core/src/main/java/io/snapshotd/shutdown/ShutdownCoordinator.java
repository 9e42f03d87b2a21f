package io.snapshotd.shutdown;

import io.snapshotd.loop.OwnerLoop;
import io.snapshotd.registry.TransactionRegistry;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Defers termination until no transaction is locked.
 *
 * <p>A termination request is considered on the owner loop. If the registry is empty the
 * coordinator terminates right away; otherwise it enters {@link ShutdownState#DRAINING} and
 * reconsiders after {@code drainIntervalMs}. In-flight workers are never interrupted.
 * With a positive {@code maxDrainMs} the coordinator gives up waiting once that much time
 * has passed since the first request and terminates with transactions still locked.
 *
 * <p>{@link #state()} and {@link #awaitTermination} may be called from any thread; state
 * transitions only happen on the owner loop.
 */
public final class ShutdownCoordinator {
    private static final Logger logger = Logger.getLogger(ShutdownCoordinator.class.getName());

    private final OwnerLoop ownerLoop;
    private final TransactionRegistry registry;
    private final long drainIntervalMs;
    private final long maxDrainMs;
    private final Runnable onTerminate;
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    private volatile ShutdownState state = ShutdownState.RUNNING;
    private long drainStartedNanos;
    private boolean recheckScheduled;

    /**
     * @param ownerLoop       loop the registry is confined to
     * @param registry        registry to watch
     * @param drainIntervalMs delay between two checks while draining, must be positive
     * @param maxDrainMs      upper bound on draining, {@code 0} for none
     * @param onTerminate     run on the owner loop when terminating
     */
    public ShutdownCoordinator(OwnerLoop ownerLoop, TransactionRegistry registry, long drainIntervalMs,
            long maxDrainMs, Runnable onTerminate) {
        this.ownerLoop = Objects.requireNonNull(ownerLoop, "ownerLoop");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.onTerminate = Objects.requireNonNull(onTerminate, "onTerminate");
        if (drainIntervalMs <= 0) {
            throw new IllegalArgumentException("drainIntervalMs must be > 0");
        }
        if (maxDrainMs < 0) {
            throw new IllegalArgumentException("maxDrainMs must be >= 0");
        }
        this.drainIntervalMs = drainIntervalMs;
        this.maxDrainMs = maxDrainMs;
    }

    /**
     * Requests termination. Repeated requests while draining are folded into the pending
     * recheck. Returns immediately.
     */
    public void requestShutdown() {
        if (state == ShutdownState.TERMINATED) {
            return;
        }
        try {
            ownerLoop.execute(this::consider);
        } catch (RejectedExecutionException e) {
            logger.fine("Owner loop already stopped; shutdown request ignored");
            terminated.complete(null);
        }
    }

    public ShutdownState state() {
        return state;
    }

    /**
     * Tells whether termination has been requested but not yet reached.
     *
     * @return {@code true} while draining
     */
    boolean isDraining() {
        return state == ShutdownState.DRAINING;
    }

    /**
     * Blocks until the coordinator has terminated.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void awaitTermination() throws InterruptedException {
        try {
            terminated.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException(e.getCause());
        }
    }

    /**
     * Blocks until the coordinator has terminated or the timeout expires.
     *
     * @return {@code true} if terminated
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            terminated.get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException(e.getCause());
        }
    }

    /**
     * Returns a future completed once the coordinator has terminated.
     *
     * @return termination future
     */
    CompletableFuture<Void> terminationFuture() {
        return terminated;
    }

    private void consider() {
        if (state == ShutdownState.TERMINATED) {
            return;
        }
        if (registry.isEmpty()) {
            terminate();
            return;
        }
        if (state == ShutdownState.RUNNING) {
            state = ShutdownState.DRAINING;
            drainStartedNanos = System.nanoTime();
        }
        long drainedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - drainStartedNanos);
        if (maxDrainMs > 0 && drainedMs >= maxDrainMs) {
            logger.severe("Drain time of " + maxDrainMs + "ms exceeded; terminating with locked snapshots "
                    + registry.lockedIds());
            terminate();
            return;
        }
        logger.info("Waiting for remaining transactions to finish...");
        if (!recheckScheduled) {
            recheckScheduled = true;
            ownerLoop.schedule(() -> {
                recheckScheduled = false;
                consider();
            }, maxDrainMs > 0 ? Math.min(drainIntervalMs, maxDrainMs - drainedMs) : drainIntervalMs);
        }
    }

    private void terminate() {
        logger.info("Terminating.");
        state = ShutdownState.TERMINATED;
        try {
            onTerminate.run();
        } finally {
            terminated.complete(null);
        }
    }
}
