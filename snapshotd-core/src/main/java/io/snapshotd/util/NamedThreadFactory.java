package io.snapshotd.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory producing daemon threads named {@code <prefix>1}, {@code <prefix>2}, ...
 *
 * <p>Every thread gets an uncaught-exception handler that logs through
 * {@code java.util.logging}, so a task dying on an unexpected error leaves a trace.
 */
public final class NamedThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(NamedThreadFactory.class.getName());

    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger(1);

    public NamedThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) ->
                logger.log(Level.SEVERE, "Uncaught exception in " + t.getName(), e));
        return thread;
    }
}
