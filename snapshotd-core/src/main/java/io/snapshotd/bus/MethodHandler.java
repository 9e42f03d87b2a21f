package io.snapshotd.bus;

/**
 * Callback invoked by the bus for each incoming call to an exported method.
 *
 * <p>Handlers may answer asynchronously; the bus must not assume the call has been
 * answered when {@link #handle} returns.
 */
@FunctionalInterface
public interface MethodHandler {
    void handle(MethodCall call);
}
