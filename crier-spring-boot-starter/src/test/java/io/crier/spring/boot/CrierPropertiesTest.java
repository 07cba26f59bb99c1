package io.crier.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrierPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(CrierProperties.class);
            assertEquals(0, props.getPublisher().getParallelism());
            assertEquals(5000, props.getPublisher().getDrainTimeoutMs());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("crier", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "crier.publisher.parallelism=6",
                "crier.publisher.drain-timeout-ms=250",
                "crier.metrics.enabled=false",
                "crier.metrics.name-prefix=orders.crier"
        ).run(ctx -> {
            var props = ctx.getBean(CrierProperties.class);
            assertEquals(6, props.getPublisher().getParallelism());
            assertEquals(250, props.getPublisher().getDrainTimeoutMs());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("orders.crier", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(CrierProperties.class)
    static class PropsConfig {
    }
}
