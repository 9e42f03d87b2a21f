package io.snapshotd.service;

import io.snapshotd.DaemonConfig;
import io.snapshotd.RecordingMetricsExporter;
import io.snapshotd.SignalRecorder;
import io.snapshotd.SnapshotDaemon;
import io.snapshotd.StubTransactionPrimitives;
import io.snapshotd.bus.BusSignal;
import io.snapshotd.bus.LocalMessageBus;
import io.snapshotd.bus.MethodErrorException;
import io.snapshotd.registry.TransactionState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransactionServiceTest {
    private static final String ERROR_NAME = DaemonConfig.DEFAULT_ERROR_NAME;

    private final LocalMessageBus bus = new LocalMessageBus();
    private final SignalRecorder signals = new SignalRecorder();
    private final StubTransactionPrimitives primitives = new StubTransactionPrimitives("base1");
    private final RecordingMetricsExporter metrics = new RecordingMetricsExporter();
    private SnapshotDaemon daemon;

    @BeforeEach
    void setUp() throws Exception {
        bus.subscribe(DaemonConfig.DEFAULT_SIGNAL_PATH, signals);
        daemon = SnapshotDaemon.builder()
                .messageBus(bus)
                .primitives(primitives)
                .metrics(metrics)
                .environment(Map.of())
                .config(new DaemonConfig().setDrainIntervalMs(20))
                .build();
        daemon.start();
    }

    @AfterEach
    void tearDown() {
        primitives.releaseCommands();
        daemon.close();
    }

    @Test
    void openCreatesSnapshotAndEmitsSignalBeforeReply() throws Exception {
        List<Object> reply = invoke("Open", "base1");

        assertEquals(List.of("base1.1"), reply);
        assertEquals(new BusSignal.TransactionOpened("base1.1"), signals.signals.poll());
        assertEquals(DaemonConfig.DEFAULT_INTERFACE, signals.interfaces.poll());
        assertTrue(daemon.registry().isEmpty());
        assertEquals(List.of("create", "init:base1", "keep:base1.1"), primitives.operations);
        assertEquals(1, metrics.opened.get());
    }

    @Test
    void openWithUnknownBaseRepliesWithPrimitiveMessage() {
        MethodErrorException error = failure("Open", "nope");

        assertEquals(ERROR_NAME, error.errorName());
        assertEquals("Base snapshot nope does not exist", error.getMessage());
        assertTrue(signals.signals.isEmpty());
    }

    @Test
    void openWithoutSnapshotIdFailsAndDiscards() {
        primitives.nullSnapshotIds.set(true);

        MethodErrorException error = failure("Open", "base1");

        assertEquals(ERROR_NAME, error.errorName());
        assertEquals("Could not determine snapshot identifier.", error.getMessage());
        assertTrue(signals.signals.isEmpty());
        assertEquals(1, primitives.discarded.get());
        assertEquals(0, metrics.opened.get());
    }

    @Test
    void openWithoutArgumentIsInvalid() {
        assertEquals("Could not read base snapshot identifier.", failure("Open").getMessage());
    }

    @Test
    void callRepliesOnceRunningAndReportsCompletion() throws Exception {
        primitives.snapshots.add("base1.1");
        primitives.holdCommands();

        List<Object> reply = invoke("Call", "base1.1", "echo hi");

        assertEquals(List.of(), reply);
        assertEquals(Optional.of(TransactionState.RUNNING), daemon.registry().state("base1.1"));

        primitives.releaseCommands();

        assertEquals(new BusSignal.CommandExecuted("base1.1", 0, "hi\n"), signals.next());
        awaitUnlocked("base1.1");
    }

    @Test
    void secondCallWhileRunningIsBusyWithoutSideEffects() throws Exception {
        primitives.snapshots.add("base1.1");
        primitives.holdCommands();
        invoke("Call", "base1.1", "echo hi");
        assertTrue(primitives.awaitCommandEntered(5, TimeUnit.SECONDS));
        int createdBefore = primitives.created.get();

        MethodErrorException busy = failure("Call", "base1.1", "echo bye");

        assertEquals(ERROR_NAME, busy.errorName());
        assertEquals("The transaction is currently in use by another thread.", busy.getMessage());
        assertEquals(createdBefore, primitives.created.get());
        assertEquals(1, daemon.activeWorkers());
        assertEquals(1, metrics.lockBusy.get());

        primitives.releaseCommands();
        assertEquals(new BusSignal.CommandExecuted("base1.1", 0, "hi\n"), signals.next());
        awaitUnlocked("base1.1");
        assertEquals(1, primitives.commandsRun.get());
    }

    @Test
    void callExtRunsOutsideTheSnapshotRoot() throws Exception {
        primitives.snapshots.add("base1.1");

        invoke("CallExt", "base1.1", "echo ext");

        assertEquals(new BusSignal.CommandExecuted("base1.1", 0, "ext\n"), signals.next());
        assertTrue(primitives.operations.contains("callExternal:[echo, ext]"));
        awaitUnlocked("base1.1");
    }

    @Test
    void callWithMissingCommandIsInvalid() {
        MethodErrorException error = failure("Call", "base1.1");

        assertEquals("Could not read D-Bus parameters.", error.getMessage());
        assertTrue(daemon.registry().isEmpty());
    }

    @Test
    void callFailureIsReportedAsErrorSignal() throws Exception {
        invoke("Call", "missing", "echo hi");

        BusSignal.ExecutionError error = assertInstanceOf(BusSignal.ExecutionError.class, signals.next());
        assertEquals("missing", error.transaction());
        assertEquals(DaemonConfig.DEFAULT_ERROR_INTERFACE, signals.interfaces.poll());
        awaitUnlocked("missing");
    }

    @Test
    void closeFinalizesAndReleasesLock() throws Exception {
        primitives.snapshots.add("base1.1");

        List<Object> reply = invoke("Close", "base1.1");

        assertEquals(List.of(0), reply);
        assertTrue(primitives.operations.contains("finalize:base1.1"));
        assertTrue(daemon.registry().isEmpty());
        assertEquals(1, metrics.closed.get());
        assertEquals(0, metrics.locked.get());
    }

    @Test
    void abortDiscardsTransaction() throws Exception {
        primitives.snapshots.add("base1.1");

        assertEquals(List.of(0), invoke("Abort", "base1.1"));

        assertFalse(primitives.snapshots.contains("base1.1"));
        assertEquals(1, primitives.discarded.get());
        assertTrue(daemon.registry().isEmpty());
    }

    @Test
    void abortOfUnknownTransactionFailsAndReleasesLock() throws Exception {
        MethodErrorException error = failure("Abort", "x");

        assertEquals("Snapshot x is not a transaction", error.getMessage());
        assertTrue(daemon.registry().isEmpty());
        assertEquals(1, metrics.lockAcquired.get());
        assertEquals(List.of(0), invoke("Close", "base1"));
    }

    @Test
    void closeWhileCallRunsIsBusy() throws Exception {
        primitives.snapshots.add("base1.1");
        primitives.holdCommands();
        invoke("Call", "base1.1", "echo hi");

        MethodErrorException busy = failure("Close", "base1.1");

        assertEquals("The transaction is currently in use by another thread.", busy.getMessage());
        assertFalse(primitives.operations.contains("finalize:base1.1"));
        primitives.releaseCommands();
        signals.next();
        awaitUnlocked("base1.1");
        assertEquals(List.of(0), invoke("Close", "base1.1"));
    }

    private List<Object> invoke(String member, Object... args) throws Exception {
        return bus.invoke(member, args).get(5, TimeUnit.SECONDS);
    }

    private MethodErrorException failure(String member, Object... args) {
        CompletableFuture<List<Object>> reply = bus.invoke(member, args);
        ExecutionException e = assertThrows(ExecutionException.class, () -> reply.get(5, TimeUnit.SECONDS));
        return assertInstanceOf(MethodErrorException.class, e.getCause());
    }

    private void awaitUnlocked(String id) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (daemon.registry().state(id).isPresent() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(Optional.empty(), daemon.registry().state(id));
    }
}
