package io.snapshotd;

import io.snapshotd.bus.MessageBus;
import io.snapshotd.bus.MethodHandler;
import io.snapshotd.bus.SignalPublisher;
import io.snapshotd.bus.Subscription;
import io.snapshotd.dispatch.CommandLine;
import io.snapshotd.dispatch.CompletionNotifier;
import io.snapshotd.dispatch.ExecutionDispatcher;
import io.snapshotd.loop.OwnerLoop;
import io.snapshotd.registry.DefaultTransactionRegistry;
import io.snapshotd.registry.TransactionRegistry;
import io.snapshotd.service.TransactionService;
import io.snapshotd.shutdown.ShutdownCoordinator;
import io.snapshotd.shutdown.ShutdownState;
import io.snapshotd.spi.MetricsExporter;
import io.snapshotd.spi.TransactionPrimitives;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the owner loop, transaction registry, request handlers,
 * execution dispatcher and shutdown coordinator into a single {@link AutoCloseable} unit.
 *
 * <p>All five methods are exported on the configured object path. Incoming calls are
 * posted to the owner loop, which is the only thread allowed to change the registry.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (SnapshotDaemon daemon = SnapshotDaemon.builder()
 *     .messageBus(bus)
 *     .primitives(primitives)
 *     .build()) {
 *   daemon.start();
 *   daemon.installShutdownHook();
 *   daemon.awaitTermination();
 * }
 * }</pre>
 *
 * <p>The message bus is owned by the caller and is not closed by {@link #close()}.
 */
public final class SnapshotDaemon implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SnapshotDaemon.class.getName());

  private final DaemonConfig config;
  private final MessageBus messageBus;
  private final MetricsExporter metrics;
  private final OwnerLoop ownerLoop;
  private final TransactionRegistry registry;
  private final CompletionNotifier notifier;
  private final ExecutionDispatcher dispatcher;
  private final ShutdownCoordinator coordinator;
  private final TransactionService service;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicBoolean hookInstalled = new AtomicBoolean();
  private volatile Subscription broadcastSubscription;

  private SnapshotDaemon(Builder builder) {
    this.config = builder.config;
    this.messageBus = builder.messageBus;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.ownerLoop = new OwnerLoop();
    this.registry = new DefaultTransactionRegistry(ownerLoop::inOwnerThread);

    SignalPublisher publisher = new SignalPublisher(messageBus, config);
    this.notifier = new CompletionNotifier(ownerLoop, registry, publisher, metrics,
        config.isUnlockOnBroadcast());
    CommandLine commandLine = builder.environment != null
        ? new CommandLine(builder.environment)
        : new CommandLine();
    this.dispatcher = new ExecutionDispatcher(builder.primitives, commandLine, notifier, metrics);
    this.coordinator = new ShutdownCoordinator(ownerLoop, registry, config.getDrainIntervalMs(),
        config.getMaxDrainMs(), ownerLoop::stop);
    this.service = new TransactionService(config, registry, builder.primitives, publisher,
        dispatcher, metrics, coordinator::state);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Exports the transaction methods, acquires the bus name and, in broadcast mode,
   * subscribes to the signal path.
   *
   * @throws TransportException if the bus refuses any of these steps
   * @throws IllegalStateException if already started or closed
   */
  public void start() throws TransportException {
    if (closed.get()) {
      throw new IllegalStateException("Daemon is closed");
    }
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Daemon already started");
    }
    Map<String, MethodHandler> exported = new LinkedHashMap<>();
    service.handlers().forEach((member, handler) -> exported.put(member, onOwnerLoop(handler)));
    messageBus.export(config.getObjectPath(), config.getInterfaceName(), exported);
    messageBus.requestName(config.getBusName());
    if (config.isUnlockOnBroadcast()) {
      broadcastSubscription = messageBus.subscribe(config.getSignalPath(), notifier);
    }
    logger.info("Started snapshotd " + version() + " on " + config.getBusName());
  }

  /**
   * Requests termination. The daemon stops once no transaction is locked.
   */
  public void requestShutdown() {
    coordinator.requestShutdown();
  }

  /**
   * Blocks until the daemon has terminated.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void awaitTermination() throws InterruptedException {
    coordinator.awaitTermination();
  }

  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return coordinator.awaitTermination(timeout, unit);
  }

  public ShutdownState state() {
    return coordinator.state();
  }

  /**
   * Returns the registry. Reads are safe from any thread; mutations are refused outside
   * the owner loop.
   *
   * @return the transaction registry
   */
  public TransactionRegistry registry() {
    return registry;
  }

  public int activeWorkers() {
    return dispatcher.activeWorkers();
  }

  public DaemonConfig config() {
    return config;
  }

  /**
   * Registers a JVM shutdown hook that requests shutdown and waits for the drain to end.
   * Does nothing when called again.
   */
  public void installShutdownHook() {
    if (!hookInstalled.compareAndSet(false, true)) {
      return;
    }
    Thread hook = new Thread(() -> {
      requestShutdown();
      try {
        awaitTermination();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }, "snapshotd-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
  }

  /**
   * Requests shutdown, waits for termination, then stops workers and the owner loop.
   * Blocks for as long as transactions stay locked unless a maximum drain time is set.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    requestShutdown();
    try {
      awaitTermination();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    Subscription subscription = broadcastSubscription;
    if (subscription != null) {
      subscription.close();
    }
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      ownerLoop.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  private MethodHandler onOwnerLoop(MethodHandler handler) {
    return call -> {
      try {
        ownerLoop.execute(() -> handler.handle(call));
      } catch (RejectedExecutionException e) {
        logger.log(Level.WARNING, "Rejecting " + call.member() + ": daemon has terminated");
        call.replyError(config.getErrorName(), "The daemon is shutting down.");
      }
    };
  }

  private static String version() {
    String version = SnapshotDaemon.class.getPackage().getImplementationVersion();
    return version != null ? version : "(development)";
  }

  /**
   * Builder for {@link SnapshotDaemon}. {@code messageBus} and {@code primitives} are
   * required; everything else has a default.
   */
  public static final class Builder {
    MessageBus messageBus;
    TransactionPrimitives primitives;
    MetricsExporter metrics;
    DaemonConfig config = new DaemonConfig();
    Map<String, String> environment;
    private final AtomicBoolean built = new AtomicBoolean(false);

    Builder() {}

    public Builder messageBus(MessageBus messageBus) {
      this.messageBus = messageBus;
      return this;
    }

    public Builder primitives(TransactionPrimitives primitives) {
      this.primitives = primitives;
      return this;
    }

    /** Optional; defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder config(DaemonConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Environment used to expand {@code $NAME} and {@code ~} in commands. Defaults to the
     * process environment.
     */
    public Builder environment(Map<String, String> environment) {
      this.environment = environment;
      return this;
    }

    /**
     * Builds the daemon. The daemon does not accept calls until {@link SnapshotDaemon#start()}.
     *
     * @return a new daemon
     * @throws NullPointerException if a required collaborator is missing
     * @throws IllegalArgumentException if a numeric option is out of range
     * @throws IllegalStateException if this builder was already used
     */
    public SnapshotDaemon build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(messageBus, "messageBus");
      Objects.requireNonNull(primitives, "primitives");
      Objects.requireNonNull(config, "config");
      if (config.getDrainIntervalMs() <= 0) {
        throw new IllegalArgumentException("drainIntervalMs must be > 0");
      }
      if (config.getMaxDrainMs() < 0) {
        throw new IllegalArgumentException("maxDrainMs must be >= 0");
      }
      return new SnapshotDaemon(this);
    }
  }
}
