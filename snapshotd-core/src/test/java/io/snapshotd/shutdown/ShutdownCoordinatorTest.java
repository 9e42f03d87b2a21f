package io.snapshotd.shutdown;

import io.snapshotd.SnapshotdException;
import io.snapshotd.loop.OwnerLoop;
import io.snapshotd.registry.DefaultTransactionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShutdownCoordinatorTest {
    private final OwnerLoop loop = new OwnerLoop();
    private final DefaultTransactionRegistry registry = new DefaultTransactionRegistry(loop::inOwnerThread);
    private final AtomicInteger terminations = new AtomicInteger();

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void terminatesImmediatelyWhenNothingIsLocked() throws Exception {
        ShutdownCoordinator coordinator = coordinator(1000, 0);

        coordinator.requestShutdown();

        assertTrue(coordinator.awaitTermination(5, TimeUnit.SECONDS));
        assertEquals(ShutdownState.TERMINATED, coordinator.state());
        assertEquals(1, terminations.get());
    }

    @Test
    void drainsUntilRegistryIsEmpty() throws Exception {
        ShutdownCoordinator coordinator = coordinator(20, 0);
        lock("base1.1");

        coordinator.requestShutdown();
        awaitState(coordinator, ShutdownState.DRAINING);
        assertFalse(coordinator.awaitTermination(150, TimeUnit.MILLISECONDS));
        assertTrue(coordinator.isDraining());
        assertEquals(0, terminations.get());

        loop.submit(() -> registry.unlock("base1.1")).get(5, TimeUnit.SECONDS);

        assertTrue(coordinator.awaitTermination(5, TimeUnit.SECONDS));
        assertEquals(1, terminations.get());
    }

    @Test
    void repeatedRequestsTerminateOnce() throws Exception {
        ShutdownCoordinator coordinator = coordinator(20, 0);
        lock("base1.1");

        coordinator.requestShutdown();
        coordinator.requestShutdown();
        coordinator.requestShutdown();
        loop.submit(() -> registry.unlock("base1.1")).get(5, TimeUnit.SECONDS);

        assertTrue(coordinator.awaitTermination(5, TimeUnit.SECONDS));
        coordinator.requestShutdown();
        assertEquals(1, terminations.get());
    }

    @Test
    void boundedDrainGivesUp() throws Exception {
        ShutdownCoordinator coordinator = coordinator(20, 100);
        lock("stuck");

        coordinator.requestShutdown();

        assertTrue(coordinator.awaitTermination(5, TimeUnit.SECONDS));
        assertEquals(ShutdownState.TERMINATED, coordinator.state());
        assertFalse(registry.isEmpty());
    }

    @Test
    void requestAfterLoopStoppedCompletesTermination() throws Exception {
        ShutdownCoordinator coordinator = coordinator(20, 0);
        loop.stop();

        coordinator.requestShutdown();

        assertTrue(coordinator.terminationFuture().isDone());
    }

    @Test
    void rejectsInvalidIntervals() {
        assertThrows(IllegalArgumentException.class, () -> coordinator(0, 0));
        assertThrows(IllegalArgumentException.class, () -> coordinator(10, -1));
    }

    private ShutdownCoordinator coordinator(long drainIntervalMs, long maxDrainMs) {
        return new ShutdownCoordinator(loop, registry, drainIntervalMs, maxDrainMs,
                terminations::incrementAndGet);
    }

    private void lock(String id) throws Exception {
        loop.submit(() -> {
            try {
                return registry.tryLock(id);
            } catch (SnapshotdException e) {
                throw new IllegalStateException(e);
            }
        }).get(5, TimeUnit.SECONDS);
    }

    private static void awaitState(ShutdownCoordinator coordinator, ShutdownState expected)
            throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (coordinator.state() != expected && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(expected, coordinator.state());
    }
}
