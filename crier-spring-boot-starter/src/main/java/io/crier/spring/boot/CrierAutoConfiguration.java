package io.crier.spring.boot;

import io.crier.Publisher;
import io.crier.spi.MetricsExporter;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the publisher.
 *
 * <p>Creates a {@link Publisher} from {@link CrierProperties} and any {@link MetricsExporter}
 * bean, and subscribes every {@link EventSubscriber @EventSubscriber} bean to it.
 *
 * @see CrierProperties
 * @see CrierMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Publisher.class)
@EnableConfigurationProperties(CrierProperties.class)
public class CrierAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Publisher publisher(CrierProperties props, ObjectProvider<MetricsExporter> metricsProvider) {
    var builder = Publisher.builder()
        .drainTimeoutMs(props.getPublisher().getDrainTimeoutMs());
    int parallelism = props.getPublisher().getParallelism();
    if (parallelism != 0) {
      builder.parallelism(parallelism);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventSubscriberRegistrar eventSubscriberRegistrar(ListableBeanFactory beanFactory,
      Publisher publisher) {
    return new EventSubscriberRegistrar(beanFactory, publisher);
  }
}
