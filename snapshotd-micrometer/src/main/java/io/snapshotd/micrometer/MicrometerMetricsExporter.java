package io.snapshotd.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.snapshotd.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code snapshotd.lock.acquired}: transaction locks taken</li>
 *   <li>{@code snapshotd.lock.busy}: requests refused because the transaction was locked</li>
 *   <li>{@code snapshotd.transaction.opened}, {@code .closed}, {@code .aborted}</li>
 *   <li>{@code snapshotd.command.executed}: commands that reported a return code</li>
 *   <li>{@code snapshotd.command.failed}: commands that ended with an {@code Error} signal</li>
 *   <li>{@code snapshotd.primitive.failure}: failures reported by the transaction primitives</li>
 *   <li>{@code snapshotd.worker.started}: command workers started</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code snapshotd.transactions.locked}: currently locked transactions</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter lockAcquired;
  private final Counter lockBusy;
  private final Counter opened;
  private final Counter closedTransactions;
  private final Counter aborted;
  private final Counter commandExecuted;
  private final Counter commandFailed;
  private final Counter primitiveFailure;
  private final Counter workerStarted;
  private final Gauge lockedGauge;

  private final AtomicInteger locked = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "snapshotd"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "snapshotd");
  }

  /**
   * Creates an exporter with a custom metric name prefix for running several daemons in one JVM.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.lockAcquired = counter(namePrefix + ".lock.acquired", "Transaction locks taken");
    this.lockBusy = counter(namePrefix + ".lock.busy", "Requests refused because the transaction was locked");
    this.opened = counter(namePrefix + ".transaction.opened", "Transactions opened");
    this.closedTransactions = counter(namePrefix + ".transaction.closed", "Transactions closed");
    this.aborted = counter(namePrefix + ".transaction.aborted", "Transactions aborted");
    this.commandExecuted = counter(namePrefix + ".command.executed", "Commands that reported a return code");
    this.commandFailed = counter(namePrefix + ".command.failed", "Commands that ended with an error");
    this.primitiveFailure = counter(namePrefix + ".primitive.failure",
        "Failures reported by the transaction primitives");
    this.workerStarted = counter(namePrefix + ".worker.started", "Command workers started");

    this.lockedGauge = Gauge.builder(namePrefix + ".transactions.locked", locked, AtomicInteger::get)
        .description("Currently locked transactions")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementLockAcquired() {
    if (closed) return;
    lockAcquired.increment();
  }

  @Override
  public void incrementLockBusy() {
    if (closed) return;
    lockBusy.increment();
  }

  @Override
  public void incrementTransactionOpened() {
    if (closed) return;
    opened.increment();
  }

  @Override
  public void incrementTransactionClosed() {
    if (closed) return;
    closedTransactions.increment();
  }

  @Override
  public void incrementTransactionAborted() {
    if (closed) return;
    aborted.increment();
  }

  @Override
  public void incrementCommandExecuted() {
    if (closed) return;
    commandExecuted.increment();
  }

  @Override
  public void incrementCommandFailed() {
    if (closed) return;
    commandFailed.increment();
  }

  @Override
  public void incrementPrimitiveFailure() {
    if (closed) return;
    primitiveFailure.increment();
  }

  @Override
  public void incrementWorkerStarted() {
    if (closed) return;
    workerStarted.increment();
  }

  @Override
  public void recordLockedTransactions(int count) {
    if (closed) return;
    locked.set(count);
  }

  /**
   * Removes all meters registered by this exporter from the registry. Called by
   * {@link io.snapshotd.SnapshotDaemon#close()}.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(lockAcquired, lockBusy, opened, closedTransactions, aborted,
        commandExecuted, commandFailed, primitiveFailure, workerStarted, lockedGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
