/**
 * Service provider interfaces for pluggable components.
 *
 * <p>Implement {@link io.snapshotd.spi.TransactionPrimitives} to supply the snapshot mechanics and
 * {@link io.snapshotd.spi.MetricsExporter} to export counters to a metrics backend.
 */
package io.snapshotd.spi;
