package io.snapshotd.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.snapshotd.micrometer.MicrometerMetricsExporter;
import io.snapshotd.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code snapshotd.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link SnapshotdAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the daemon.
 */
@AutoConfiguration(before = SnapshotdAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "snapshotd.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(SnapshotdProperties.class)
public class SnapshotdMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, SnapshotdProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
