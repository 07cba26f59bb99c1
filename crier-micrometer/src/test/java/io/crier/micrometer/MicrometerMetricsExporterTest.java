package io.crier.micrometer;

import io.crier.Event;
import io.crier.Publisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementPublished() {
    exporter.incrementPublished();
    exporter.incrementPublished();
    assertEquals(2.0, counter("crier.publish").count());
  }

  @Test
  void incrementHandlerSuccess() {
    exporter.incrementHandlerSuccess();
    assertEquals(1.0, counter("crier.handler.success").count());
  }

  @Test
  void incrementHandlerFailure() {
    exporter.incrementHandlerFailure();
    exporter.incrementHandlerFailure();
    exporter.incrementHandlerFailure();
    assertEquals(3.0, counter("crier.handler.failure").count());
  }

  @Test
  void incrementPoisoned() {
    exporter.incrementPoisoned();
    assertEquals(1.0, counter("crier.handler.poisoned").count());
  }

  @Test
  void recordSubscriptions() {
    exporter.recordSubscriptions(4, 2);
    assertEquals(4.0, gauge("crier.subscriptions.shared").value());
    assertEquals(2.0, gauge("crier.subscriptions.exclusive").value());

    exporter.recordSubscriptions(0, 0);
    assertEquals(0.0, gauge("crier.subscriptions.shared").value());
    assertEquals(0.0, gauge("crier.subscriptions.exclusive").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "orders.crier");
    custom.incrementPublished();
    custom.recordSubscriptions(3, 1);

    assertEquals(1.0, counter("orders.crier.publish").count());
    assertEquals(3.0, gauge("orders.crier.subscriptions.shared").value());
    assertEquals(1.0, gauge("orders.crier.subscriptions.exclusive").value());
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "crier."));
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterCalls() {
    exporter.close();
    exporter.incrementPublished();
    exporter.recordSubscriptions(5, 5);

    assertNull(registry.find("crier.publish").counter());
    assertNull(registry.find("crier.subscriptions.shared").gauge());
  }

  @Test
  void publisherReportsThroughExporter() {
    try (Publisher publisher = Publisher.builder().parallelism(2).metrics(exporter).build()) {
      publisher.subscribeWith(Tick.class, e -> {
      });
      publisher.subscribeWith(Tick.class, e -> {
        throw new IllegalStateException("boom");
      });

      publisher.publish(new Tick(1));

      assertEquals(1.0, counter("crier.publish").count());
      assertEquals(1.0, counter("crier.handler.success").count());
      assertEquals(1.0, counter("crier.handler.failure").count());
      assertEquals(2.0, gauge("crier.subscriptions.shared").value());
    }
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }

  record Tick(int seq) implements Event {
  }
}
