/**
 * Snapshot transaction daemon core.
 *
 * <p>{@link io.snapshotd.SnapshotDaemon} wires everything together; {@link io.snapshotd.DaemonConfig}
 * holds bus names and shutdown options. Failures are reported through the checked
 * {@link io.snapshotd.SnapshotdException} hierarchy.
 *
 * @see io.snapshotd.SnapshotDaemon
 * @see io.snapshotd.DaemonConfig
 */
package io.snapshotd;
