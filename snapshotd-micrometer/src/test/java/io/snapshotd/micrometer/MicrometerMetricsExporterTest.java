package io.snapshotd.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.snapshotd.PrimitiveException;
import io.snapshotd.SnapshotDaemon;
import io.snapshotd.bus.LocalMessageBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void lockCounters() {
    exporter.incrementLockAcquired();
    exporter.incrementLockAcquired();
    exporter.incrementLockBusy();

    assertEquals(2.0, counter("snapshotd.lock.acquired").count());
    assertEquals(1.0, counter("snapshotd.lock.busy").count());
  }

  @Test
  void transactionCounters() {
    exporter.incrementTransactionOpened();
    exporter.incrementTransactionClosed();
    exporter.incrementTransactionAborted();
    exporter.incrementTransactionAborted();

    assertEquals(1.0, counter("snapshotd.transaction.opened").count());
    assertEquals(1.0, counter("snapshotd.transaction.closed").count());
    assertEquals(2.0, counter("snapshotd.transaction.aborted").count());
  }

  @Test
  void commandCounters() {
    exporter.incrementWorkerStarted();
    exporter.incrementCommandExecuted();
    exporter.incrementCommandFailed();
    exporter.incrementPrimitiveFailure();

    assertEquals(1.0, counter("snapshotd.worker.started").count());
    assertEquals(1.0, counter("snapshotd.command.executed").count());
    assertEquals(1.0, counter("snapshotd.command.failed").count());
    assertEquals(1.0, counter("snapshotd.primitive.failure").count());
  }

  @Test
  void lockedTransactionsGauge() {
    exporter.recordLockedTransactions(3);
    assertEquals(3.0, gauge("snapshotd.transactions.locked").value());

    exporter.recordLockedTransactions(0);
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "tukit");
    custom.incrementLockBusy();
    custom.recordLockedTransactions(2);

    assertEquals(1.0, counter("tukit.lock.busy").count());
    assertEquals(2.0, gauge("tukit.transactions.locked").value());
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "snapshotd."));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.close();
    exporter.incrementLockAcquired();
    exporter.recordLockedTransactions(5);

    assertNull(registry.find("snapshotd.lock.acquired").counter());
    assertNull(registry.find("snapshotd.transactions.locked").gauge());
  }

  @Test
  void daemonReportsRefusedRequestsAndClosesExporter() throws Exception {
    LocalMessageBus bus = new LocalMessageBus();
    SnapshotDaemon daemon = SnapshotDaemon.builder()
        .messageBus(bus)
        .primitives(() -> {
          throw new PrimitiveException("No snapshot backend");
        })
        .metrics(exporter)
        .build();
    daemon.start();

    var reply = bus.invoke("Abort", "base1.1");
    assertThrows(ExecutionException.class, () -> reply.get(5, TimeUnit.SECONDS));
    assertEquals(1.0, counter("snapshotd.lock.acquired").count());
    assertEquals(1.0, counter("snapshotd.primitive.failure").count());

    daemon.close();

    assertNull(registry.find("snapshotd.lock.acquired").counter());
    assertEquals(List.of(), registry.getMeters());
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
