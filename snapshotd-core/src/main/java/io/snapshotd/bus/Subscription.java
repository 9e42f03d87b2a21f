package io.snapshotd.bus;

/**
 * Handle returned by {@link MessageBus#subscribe}; closing it stops delivery.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {
    @Override
    void close();
}
