/**
 * Spring Boot auto-configuration for the snapshot transaction daemon.
 *
 * <p>{@link io.snapshotd.spring.boot.SnapshotdAutoConfiguration} builds and starts a
 * {@link io.snapshotd.SnapshotDaemon} when the application provides a
 * {@link io.snapshotd.bus.MessageBus} and {@link io.snapshotd.spi.TransactionPrimitives}.
 * Settings bind from {@code snapshotd.*} via {@link io.snapshotd.spring.boot.SnapshotdProperties}.
 *
 * @see io.snapshotd.spring.boot.SnapshotdAutoConfiguration
 * @see io.snapshotd.spring.boot.SnapshotdMicrometerAutoConfiguration
 */
package io.snapshotd.spring.boot;
