/**
 * Micrometer bridge for exporting daemon metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.snapshotd.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.snapshotd.spi.MetricsExporter} SPI using Micrometer counters and a gauge.
 *
 * @see io.snapshotd.micrometer.MicrometerMetricsExporter
 */
package io.snapshotd.micrometer;
