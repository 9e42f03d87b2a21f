package io.snapshotd.bus;

import io.snapshotd.DaemonConfig;
import io.snapshotd.TransportException;

import java.util.Objects;

/**
 * Emits daemon signals on the configured path, choosing the interface per signal type.
 */
public final class SignalPublisher {
    private final MessageBus bus;
    private final DaemonConfig config;

    public SignalPublisher(MessageBus bus, DaemonConfig config) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.config = Objects.requireNonNull(config, "config");
    }

    public void publish(BusSignal signal) throws TransportException {
        String interfaceName = signal instanceof BusSignal.ExecutionError
                ? config.getErrorInterfaceName()
                : config.getInterfaceName();
        bus.emit(config.getSignalPath(), interfaceName, signal);
    }
}
