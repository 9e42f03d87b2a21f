package io.snapshotd.dispatch;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Everything a command worker needs, owned by the worker.
 *
 * <p>Holds only immutable values copied out of the request, never the originating
 * {@link io.snapshotd.bus.MethodCall}, so the request can be answered and discarded while
 * the worker is still running. The start signal fires at most once.
 */
public final class ExecutionContext {
    private final String transactionId;
    private final String command;
    private final ExecutionMode mode;
    private final Runnable startSignal;
    private final AtomicBoolean started = new AtomicBoolean();

    public ExecutionContext(String transactionId, String command, ExecutionMode mode, Runnable startSignal) {
        this.transactionId = Objects.requireNonNull(transactionId, "transactionId");
        this.command = Objects.requireNonNull(command, "command");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.startSignal = Objects.requireNonNull(startSignal, "startSignal");
    }

    public String transactionId() {
        return transactionId;
    }

    public String command() {
        return command;
    }

    public ExecutionMode mode() {
        return mode;
    }

    /**
     * Fires the start signal on the first call; later calls do nothing.
     *
     * @return {@code true} if this call fired the signal
     */
    public boolean signalStarted() {
        if (!started.compareAndSet(false, true)) {
            return false;
        }
        startSignal.run();
        return true;
    }

    boolean hasStarted() {
        return started.get();
    }
}
