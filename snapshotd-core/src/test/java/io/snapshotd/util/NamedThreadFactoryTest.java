package io.snapshotd.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NamedThreadFactoryTest {

    @Test
    void createsNamedDaemonThreads() {
        NamedThreadFactory factory = new NamedThreadFactory("snapshotd-worker-");

        Thread thread = factory.newThread(() -> {
        });

        assertTrue(thread.isDaemon());
        assertEquals("snapshotd-worker-1", thread.getName());
    }

    @Test
    void numbersThreadsSequentially() {
        NamedThreadFactory factory = new NamedThreadFactory("t-");

        factory.newThread(() -> {
        });
        Thread second = factory.newThread(() -> {
        });

        assertEquals("t-2", second.getName());
    }

    @Test
    void uncaughtExceptionsAreHandled() throws InterruptedException {
        NamedThreadFactory factory = new NamedThreadFactory("failing-");
        AtomicReference<Thread.UncaughtExceptionHandler> handler = new AtomicReference<>();

        Thread thread = factory.newThread(() -> {
            throw new IllegalStateException("boom");
        });
        handler.set(thread.getUncaughtExceptionHandler());
        thread.start();
        thread.join(5000);

        assertNotNull(handler.get());
        assertFalse(thread.isAlive());
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new NamedThreadFactory(null));
    }
}
