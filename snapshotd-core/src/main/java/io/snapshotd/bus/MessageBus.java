package io.snapshotd.bus;

import io.snapshotd.TransportException;

import java.util.Map;

/**
 * Transport boundary of the daemon: exporting methods, emitting signals and observing
 * broadcasts. Connection setup, name registration and marshaling live behind this interface.
 *
 * <p>Implementations must be thread-safe: signals are emitted from worker threads while
 * method calls are answered from the owner loop.
 *
 * @see LocalMessageBus
 */
public interface MessageBus extends AutoCloseable {

    /**
     * Takes a well-known name so that clients can find the daemon.
     *
     * @param name the bus name, e.g. {@code org.opensuse.tukit}
     * @throws TransportException if the name cannot be acquired
     */
    void requestName(String name) throws TransportException;

    /**
     * Exports a set of methods under an object path and interface.
     *
     * @param objectPath    object path, e.g. {@code /org/opensuse/tukit/Transaction}
     * @param interfaceName interface name
     * @param methods       handlers keyed by member name
     * @throws TransportException if the object cannot be exported
     */
    void export(String objectPath, String interfaceName, Map<String, MethodHandler> methods)
            throws TransportException;

    /**
     * Emits a signal.
     *
     * @param objectPath    path the signal is emitted on
     * @param interfaceName interface the signal belongs to
     * @param signal        the signal
     * @throws TransportException if the bus cannot be reached
     */
    void emit(String objectPath, String interfaceName, BusSignal signal) throws TransportException;

    /**
     * Subscribes to every signal broadcast on {@code objectPath}, whoever the sender is.
     *
     * @param objectPath path to match
     * @param listener   receives matching signals
     * @return a subscription handle
     * @throws TransportException if the match cannot be registered
     */
    Subscription subscribe(String objectPath, SignalListener listener) throws TransportException;

    @Override
    void close();
}
