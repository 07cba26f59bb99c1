package io.crier.micrometer;

import io.crier.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code crier.publish}: publish calls</li>
 *   <li>{@code crier.handler.success}: handler invocations that returned normally</li>
 *   <li>{@code crier.handler.failure}: handler invocations that threw</li>
 *   <li>{@code crier.handler.poisoned}: publishes aborted by a poisoned mutating handler</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code crier.subscriptions.shared}: current read-only subscriptions</li>
 *   <li>{@code crier.subscriptions.exclusive}: current mutating subscriptions</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter published;
  private final Counter handlerSuccess;
  private final Counter handlerFailure;
  private final Counter poisoned;
  private final Gauge sharedGauge;
  private final Gauge exclusiveGauge;

  private final AtomicInteger sharedSubscriptions = new AtomicInteger();
  private final AtomicInteger exclusiveSubscriptions = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "crier"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "crier");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for applications running more than
   * one publisher.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.crier"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.published = Counter.builder(namePrefix + ".publish")
        .description("Events published")
        .register(registry);
    this.handlerSuccess = Counter.builder(namePrefix + ".handler.success")
        .description("Handler invocations that returned normally")
        .register(registry);
    this.handlerFailure = Counter.builder(namePrefix + ".handler.failure")
        .description("Handler invocations that threw")
        .register(registry);
    this.poisoned = Counter.builder(namePrefix + ".handler.poisoned")
        .description("Publishes aborted by a poisoned mutating handler")
        .register(registry);

    this.sharedGauge = Gauge.builder(namePrefix + ".subscriptions.shared",
            sharedSubscriptions, AtomicInteger::get)
        .description("Read-only subscriptions")
        .register(registry);
    this.exclusiveGauge = Gauge.builder(namePrefix + ".subscriptions.exclusive",
            exclusiveSubscriptions, AtomicInteger::get)
        .description("Mutating subscriptions")
        .register(registry);
  }

  @Override
  public void incrementPublished() {
    if (closed) return;
    published.increment();
  }

  @Override
  public void incrementHandlerSuccess() {
    if (closed) return;
    handlerSuccess.increment();
  }

  @Override
  public void incrementHandlerFailure() {
    if (closed) return;
    handlerFailure.increment();
  }

  @Override
  public void incrementPoisoned() {
    if (closed) return;
    poisoned.increment();
  }

  @Override
  public void recordSubscriptions(int shared, int exclusive) {
    if (closed) return;
    sharedSubscriptions.set(shared);
    exclusiveSubscriptions.set(exclusive);
  }

  /**
   * Removes all meters registered by this exporter from the registry and turns later calls
   * into no-ops.
   *
   * <p>Call this when the {@link io.crier.Publisher} using the exporter is closed, to prevent
   * stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(published, handlerSuccess, handlerFailure, poisoned,
        sharedGauge, exclusiveGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
