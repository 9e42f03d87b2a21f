package io.snapshotd.spring.boot;

import io.snapshotd.DaemonConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotdPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(SnapshotdProperties.class);
            assertEquals("org.opensuse.tukit", props.getBus().getName());
            assertEquals("/org/opensuse/tukit/Transaction", props.getBus().getObjectPath());
            assertEquals("org.opensuse.tukit.Transaction", props.getBus().getInterfaceName());
            assertEquals("/org/opensuse/tukit", props.getBus().getSignalPath());
            assertEquals("org.opensuse.tukit", props.getBus().getErrorInterfaceName());
            assertEquals("org.opensuse.tukit.Error", props.getBus().getErrorName());
            assertFalse(props.getBus().isUnlockOnBroadcast());
            assertEquals(1000, props.getShutdown().getDrainIntervalMs());
            assertEquals(0, props.getShutdown().getMaxDrainMs());
            assertFalse(props.getShutdown().isRejectWhileDraining());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("snapshotd", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValuesReachDaemonConfig() {
        runner.withPropertyValues(
                "snapshotd.bus.name=org.example.snapshots",
                "snapshotd.bus.object-path=/org/example/Transaction",
                "snapshotd.bus.interface-name=org.example.Transaction",
                "snapshotd.bus.signal-path=/org/example",
                "snapshotd.bus.error-interface-name=org.example",
                "snapshotd.bus.error-name=org.example.Error",
                "snapshotd.bus.unlock-on-broadcast=true",
                "snapshotd.shutdown.drain-interval-ms=250",
                "snapshotd.shutdown.max-drain-ms=60000",
                "snapshotd.shutdown.reject-while-draining=true",
                "snapshotd.metrics.enabled=false",
                "snapshotd.metrics.name-prefix=example"
        ).run(ctx -> {
            DaemonConfig config = ctx.getBean(SnapshotdProperties.class).toDaemonConfig();
            assertEquals("org.example.snapshots", config.getBusName());
            assertEquals("/org/example/Transaction", config.getObjectPath());
            assertEquals("org.example.Transaction", config.getInterfaceName());
            assertEquals("/org/example", config.getSignalPath());
            assertEquals("org.example", config.getErrorInterfaceName());
            assertEquals("org.example.Error", config.getErrorName());
            assertTrue(config.isUnlockOnBroadcast());
            assertEquals(250, config.getDrainIntervalMs());
            assertEquals(60000, config.getMaxDrainMs());
            assertTrue(config.isRejectWhileDraining());
        });
    }

    @Configuration
    @EnableConfigurationProperties(SnapshotdProperties.class)
    static class PropsConfig {
    }
}
