package io.snapshotd.bus;

/**
 * Observer of signals broadcast on a bus path.
 */
@FunctionalInterface
public interface SignalListener {
    void onSignal(String interfaceName, BusSignal signal);
}
