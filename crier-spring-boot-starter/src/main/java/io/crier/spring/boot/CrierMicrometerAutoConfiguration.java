package io.crier.spring.boot;

import io.crier.Publisher;
import io.crier.micrometer.MicrometerMetricsExporter;
import io.crier.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Exports publisher counters and subscription gauges to the application's
 * {@link MeterRegistry}.
 *
 * <p>Applies when {@code crier-micrometer} is on the classpath, a {@link MeterRegistry} bean
 * exists and {@code crier.metrics.enabled} is not {@code false}. Meters are named with
 * {@code crier.metrics.name-prefix} and removed from the registry when the context closes.
 * A user-defined {@link MetricsExporter} bean replaces the Micrometer one.
 *
 * <p>Ordered ahead of {@link CrierAutoConfiguration}, whose {@link Publisher} picks the
 * exporter up.
 */
@AutoConfiguration(before = CrierAutoConfiguration.class)
@ConditionalOnClass({Publisher.class, MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "crier.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(CrierProperties.class)
public class CrierMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, CrierProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
