package io.snapshotd.spring.boot;

import io.snapshotd.DaemonConfig;
import io.snapshotd.SnapshotDaemon;
import io.snapshotd.bus.MessageBus;
import io.snapshotd.spi.MetricsExporter;
import io.snapshotd.spi.TransactionPrimitives;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the snapshot transaction daemon.
 *
 * <p>Builds a {@link SnapshotDaemon} from the application's {@link MessageBus} and
 * {@link TransactionPrimitives} beans and {@link SnapshotdProperties}. The daemon is started
 * with the context and closed, after draining, when the context shuts down.
 *
 * @see SnapshotdProperties
 * @see SnapshotdMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(SnapshotDaemon.class)
@ConditionalOnBean({MessageBus.class, TransactionPrimitives.class})
@EnableConfigurationProperties(SnapshotdProperties.class)
public class SnapshotdAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public DaemonConfig snapshotdDaemonConfig(SnapshotdProperties props) {
    return props.toDaemonConfig();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  public SnapshotDaemon snapshotDaemon(DaemonConfig config,
      MessageBus messageBus,
      TransactionPrimitives primitives,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var builder = SnapshotDaemon.builder()
        .messageBus(messageBus)
        .primitives(primitives)
        .config(config);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }
}
