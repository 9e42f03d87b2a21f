package io.snapshotd.spring.boot;

import io.snapshotd.DaemonConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the snapshot transaction daemon.
 *
 * @see SnapshotdAutoConfiguration
 */
@ConfigurationProperties(prefix = "snapshotd")
public class SnapshotdProperties {

    private final Bus bus = new Bus();
    private final Shutdown shutdown = new Shutdown();
    private final Metrics metrics = new Metrics();

    public Bus getBus() {
        return bus;
    }

    public Shutdown getShutdown() {
        return shutdown;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Converts these properties into a {@link DaemonConfig}.
     *
     * @return a new daemon configuration
     */
    public DaemonConfig toDaemonConfig() {
        return new DaemonConfig()
                .setBusName(bus.getName())
                .setObjectPath(bus.getObjectPath())
                .setInterfaceName(bus.getInterfaceName())
                .setSignalPath(bus.getSignalPath())
                .setErrorInterfaceName(bus.getErrorInterfaceName())
                .setErrorName(bus.getErrorName())
                .setUnlockOnBroadcast(bus.isUnlockOnBroadcast())
                .setDrainIntervalMs(shutdown.getDrainIntervalMs())
                .setMaxDrainMs(shutdown.getMaxDrainMs())
                .setRejectWhileDraining(shutdown.isRejectWhileDraining());
    }

    public static class Bus {
        /**
         * Well-known name requested on the bus.
         */
        private String name = DaemonConfig.DEFAULT_BUS_NAME;
        private String objectPath = DaemonConfig.DEFAULT_OBJECT_PATH;
        private String interfaceName = DaemonConfig.DEFAULT_INTERFACE;
        /**
         * Path signals are emitted on.
         */
        private String signalPath = DaemonConfig.DEFAULT_SIGNAL_PATH;
        private String errorInterfaceName = DaemonConfig.DEFAULT_ERROR_INTERFACE;
        private String errorName = DaemonConfig.DEFAULT_ERROR_NAME;
        /**
         * Release locks when a signal naming the transaction is seen on the signal path.
         */
        private boolean unlockOnBroadcast = false;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getObjectPath() {
            return objectPath;
        }

        public void setObjectPath(String objectPath) {
            this.objectPath = objectPath;
        }

        public String getInterfaceName() {
            return interfaceName;
        }

        public void setInterfaceName(String interfaceName) {
            this.interfaceName = interfaceName;
        }

        public String getSignalPath() {
            return signalPath;
        }

        public void setSignalPath(String signalPath) {
            this.signalPath = signalPath;
        }

        public String getErrorInterfaceName() {
            return errorInterfaceName;
        }

        public void setErrorInterfaceName(String errorInterfaceName) {
            this.errorInterfaceName = errorInterfaceName;
        }

        public String getErrorName() {
            return errorName;
        }

        public void setErrorName(String errorName) {
            this.errorName = errorName;
        }

        public boolean isUnlockOnBroadcast() {
            return unlockOnBroadcast;
        }

        public void setUnlockOnBroadcast(boolean unlockOnBroadcast) {
            this.unlockOnBroadcast = unlockOnBroadcast;
        }
    }

    public static class Shutdown {
        private long drainIntervalMs = 1000;
        /**
         * Maximum time to wait for locked transactions; 0 waits indefinitely.
         */
        private long maxDrainMs = 0;
        private boolean rejectWhileDraining = false;

        public long getDrainIntervalMs() {
            return drainIntervalMs;
        }

        public void setDrainIntervalMs(long drainIntervalMs) {
            this.drainIntervalMs = drainIntervalMs;
        }

        public long getMaxDrainMs() {
            return maxDrainMs;
        }

        public void setMaxDrainMs(long maxDrainMs) {
            this.maxDrainMs = maxDrainMs;
        }

        public boolean isRejectWhileDraining() {
            return rejectWhileDraining;
        }

        public void setRejectWhileDraining(boolean rejectWhileDraining) {
            this.rejectWhileDraining = rejectWhileDraining;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "snapshotd";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
