/**
 * Message bus boundary: exported methods, method calls, and the three signals the daemon emits.
 *
 * <p>{@link io.snapshotd.bus.MessageBus} is implemented by the transport in use.
 * {@link io.snapshotd.bus.LocalMessageBus} is an in-process implementation for embedding and tests.
 *
 * @see io.snapshotd.bus.MessageBus
 * @see io.snapshotd.bus.BusSignal
 */
package io.snapshotd.bus;
