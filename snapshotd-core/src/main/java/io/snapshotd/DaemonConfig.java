package io.snapshotd;

import java.util.Objects;

/**
 * Bus names and shutdown behavior of a {@link SnapshotDaemon}. Defaults match the
 * {@code org.opensuse.tukit} protocol.
 */
public final class DaemonConfig {
  public static final String DEFAULT_BUS_NAME = "org.opensuse.tukit";
  public static final String DEFAULT_OBJECT_PATH = "/org/opensuse/tukit/Transaction";
  public static final String DEFAULT_INTERFACE = "org.opensuse.tukit.Transaction";
  public static final String DEFAULT_SIGNAL_PATH = "/org/opensuse/tukit";
  public static final String DEFAULT_ERROR_INTERFACE = "org.opensuse.tukit";
  public static final String DEFAULT_ERROR_NAME = "org.opensuse.tukit.Error";

  private String busName = DEFAULT_BUS_NAME;
  private String objectPath = DEFAULT_OBJECT_PATH;
  private String interfaceName = DEFAULT_INTERFACE;
  private String signalPath = DEFAULT_SIGNAL_PATH;
  private String errorInterfaceName = DEFAULT_ERROR_INTERFACE;
  private String errorName = DEFAULT_ERROR_NAME;

  private long drainIntervalMs = 1000L;
  private long maxDrainMs = 0L;
  private boolean rejectWhileDraining = false;
  private boolean unlockOnBroadcast = false;

  public String getBusName() {
    return busName;
  }

  public DaemonConfig setBusName(String busName) {
    this.busName = Objects.requireNonNull(busName, "busName");
    return this;
  }

  public String getObjectPath() {
    return objectPath;
  }

  public DaemonConfig setObjectPath(String objectPath) {
    this.objectPath = Objects.requireNonNull(objectPath, "objectPath");
    return this;
  }

  public String getInterfaceName() {
    return interfaceName;
  }

  public DaemonConfig setInterfaceName(String interfaceName) {
    this.interfaceName = Objects.requireNonNull(interfaceName, "interfaceName");
    return this;
  }

  /** Path that signals are emitted on and that the broadcast unlock listens to. */
  public String getSignalPath() {
    return signalPath;
  }

  public DaemonConfig setSignalPath(String signalPath) {
    this.signalPath = Objects.requireNonNull(signalPath, "signalPath");
    return this;
  }

  /** Interface of the {@code Error} signal. */
  public String getErrorInterfaceName() {
    return errorInterfaceName;
  }

  public DaemonConfig setErrorInterfaceName(String errorInterfaceName) {
    this.errorInterfaceName = Objects.requireNonNull(errorInterfaceName, "errorInterfaceName");
    return this;
  }

  /** Error name used in error replies. */
  public String getErrorName() {
    return errorName;
  }

  public DaemonConfig setErrorName(String errorName) {
    this.errorName = Objects.requireNonNull(errorName, "errorName");
    return this;
  }

  /** Delay between two checks of the registry while draining. */
  public long getDrainIntervalMs() {
    return drainIntervalMs;
  }

  public DaemonConfig setDrainIntervalMs(long drainIntervalMs) {
    this.drainIntervalMs = drainIntervalMs;
    return this;
  }

  /** Upper bound on draining; {@code 0} waits for in-flight work indefinitely. */
  public long getMaxDrainMs() {
    return maxDrainMs;
  }

  public DaemonConfig setMaxDrainMs(long maxDrainMs) {
    this.maxDrainMs = maxDrainMs;
    return this;
  }

  /** When set, Open, Call and CallExt are refused once shutdown has been requested. */
  public boolean isRejectWhileDraining() {
    return rejectWhileDraining;
  }

  public DaemonConfig setRejectWhileDraining(boolean rejectWhileDraining) {
    this.rejectWhileDraining = rejectWhileDraining;
    return this;
  }

  /**
   * When set, any signal seen on the signal path unlocks the transaction it names. Off by
   * default: workers release their lock through the owner loop.
   */
  public boolean isUnlockOnBroadcast() {
    return unlockOnBroadcast;
  }

  public DaemonConfig setUnlockOnBroadcast(boolean unlockOnBroadcast) {
    this.unlockOnBroadcast = unlockOnBroadcast;
    return this;
  }
}
