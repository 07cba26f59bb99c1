package io.crier;

import io.crier.dispatch.FanOutDispatcher;
import io.crier.handler.ExclusiveHandlerAdapter;
import io.crier.handler.SharedHandlerAdapter;
import io.crier.registry.DefaultSubscriptionRegistry;
import io.crier.registry.SubscriptionKind;
import io.crier.registry.SubscriptionRegistry;
import io.crier.spi.MetricsExporter;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * In-process typed event publisher.
 *
 * <p>Handlers subscribe to one event class each. {@link #publish(Event)} wraps the event in an
 * {@link EventEnvelope} and delivers it to every handler whose event class is exactly the
 * event's runtime class; other handlers are skipped. The call blocks until every matching
 * handler has finished and reports their faults in the returned {@link PublishResult}.
 *
 * <ul>
 *   <li>{@link EventHandler}s are read-only and run concurrently on a bounded worker pool.</li>
 *   <li>{@link MutatingEventHandler}s run on the publishing thread, one invocation at a time
 *       per handler, even when several threads publish at once.</li>
 * </ul>
 *
 * <pre>{@code
 * try (Publisher publisher = Publisher.builder().parallelism(4).build()) {
 *   long id = publisher.subscribe(new AuditHandler());
 *   publisher.subscribeMut(new OrderTotals());
 *
 *   PublishResult result = publisher.publish(new OrderPlaced("order-123", 99_99));
 *   result.throwIfFailed();
 *
 *   publisher.unsubscribe(id);
 * }
 * }</pre>
 *
 * <p>This class is thread-safe. Subscribing and unsubscribing never wait for a publish in
 * progress; a publish delivers to the subscriptions present when it started.
 *
 * @see Publisher.Builder
 */
public final class Publisher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Publisher.class.getName());

  private final SubscriptionRegistry registry;
  private final FanOutDispatcher dispatcher;
  private final MetricsExporter metrics;
  private final AtomicBoolean closed = new AtomicBoolean();

  private Publisher(Builder builder) {
    this.registry = builder.registry != null ? builder.registry : new DefaultSubscriptionRegistry();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    int parallelism = builder.parallelism != null ? builder.parallelism : defaultParallelism();
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be >= 1");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.dispatcher = new FanOutDispatcher(parallelism, metrics, builder.drainTimeoutMs);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a publisher with default settings.
   */
  public static Publisher create() {
    return builder().build();
  }

  static int defaultParallelism() {
    return Math.max(1, Runtime.getRuntime().availableProcessors());
  }

  /**
   * Subscribes a read-only handler.
   *
   * @param handler the handler
   * @return the subscription id
   * @throws NullPointerException     if {@code handler} is null
   * @throws IllegalArgumentException if the handler's event type cannot be resolved
   * @throws IllegalStateException    if this publisher is closed
   */
  public <E extends Event> long subscribe(EventHandler<E> handler) {
    Objects.requireNonNull(handler, "handler");
    ensureOpen();
    SharedHandlerAdapter<E> adapter = new SharedHandlerAdapter<>(handler);
    long id = registry.add(SubscriptionKind.SHARED, adapter);
    logger.fine("Subscribed " + adapter + " as subscriptionId=" + id);
    recordSubscriptions();
    return id;
  }

  /**
   * Subscribes a read-only callback for events of exactly {@code eventType}.
   *
   * @return the subscription id
   * @see EventHandler#of(Class, EventHandler.Callback)
   */
  public <E extends Event> long subscribeWith(Class<E> eventType, EventHandler.Callback<? super E> callback) {
    return subscribe(EventHandler.of(eventType, callback));
  }

  /**
   * Subscribes a mutating handler. It is invoked on publishing threads, never concurrently
   * with itself.
   *
   * @param handler the handler
   * @return the subscription id
   * @throws NullPointerException     if {@code handler} is null
   * @throws IllegalArgumentException if the handler's event type cannot be resolved
   * @throws IllegalStateException    if this publisher is closed
   */
  public <E extends Event> long subscribeMut(MutatingEventHandler<E> handler) {
    Objects.requireNonNull(handler, "handler");
    ensureOpen();
    ExclusiveHandlerAdapter<E> adapter = new ExclusiveHandlerAdapter<>(handler);
    long id = registry.add(SubscriptionKind.EXCLUSIVE, adapter);
    logger.fine("Subscribed " + adapter + " as subscriptionId=" + id);
    recordSubscriptions();
    return id;
  }

  /**
   * Removes a subscription. Unknown ids, including ids already removed, are ignored.
   *
   * @return {@code true} if a subscription was removed
   */
  public boolean unsubscribe(long subscriptionId) {
    boolean removed = registry.remove(subscriptionId);
    if (removed) {
      logger.fine("Unsubscribed subscriptionId=" + subscriptionId);
      recordSubscriptions();
    }
    return removed;
  }

  /**
   * Removes a mutating subscription. Ids are unique across both kinds, so this behaves
   * exactly like {@link #unsubscribe(long)}.
   */
  public boolean unsubscribeMut(long subscriptionId) {
    return unsubscribe(subscriptionId);
  }

  /**
   * Publishes an event and waits for every matching handler.
   *
   * @param event the event
   * @return the outcome; handler faults never propagate as exceptions
   * @throws NullPointerException          if {@code event} is null
   * @throws IllegalStateException         if this publisher is closed
   * @throws PoisonedSubscriptionException if a mutating handler that failed earlier is reached
   */
  public <E extends Event> PublishResult publish(E event) {
    Objects.requireNonNull(event, "event");
    ensureOpen();
    EventEnvelope envelope = EventEnvelope.of(event);
    metrics.incrementPublished();
    return dispatcher.dispatch(envelope, registry.snapshot());
  }

  public int subscriptionCount() {
    return registry.size();
  }

  public int parallelism() {
    return dispatcher.parallelism();
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Shuts down the worker pool and drops every subscription. Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    dispatcher.close();
    registry.clear();
    recordSubscriptions();
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("Publisher is closed");
    }
  }

  private void recordSubscriptions() {
    metrics.recordSubscriptions(
        registry.count(SubscriptionKind.SHARED), registry.count(SubscriptionKind.EXCLUSIVE));
  }

  /** Builder for {@link Publisher}. */
  public static final class Builder {
    private Integer parallelism;
    private MetricsExporter metrics;
    private long drainTimeoutMs = 5000;
    private SubscriptionRegistry registry;

    private Builder() {}

    /**
     * Sets the number of worker threads, which is also the maximum number of read-only
     * handlers one publish runs at the same time.
     *
     * <p>Optional. Defaults to the number of available processors. Must be &ge; 1.
     *
     * @param parallelism worker count
     * @return this builder
     */
    public Builder parallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the maximum time in milliseconds {@link Publisher#close()} waits for running
     * handlers before interrupting them.
     *
     * <p>Optional. Defaults to {@code 5000} ms. Must be &ge; 0.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the subscription registry.
     *
     * <p>Optional. Defaults to a new {@link DefaultSubscriptionRegistry}. The registry must not
     * be shared with another publisher.
     *
     * @param registry the registry
     * @return this builder
     */
    public Builder registry(SubscriptionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Builds the publisher. Worker threads are started on demand.
     *
     * @throws IllegalArgumentException if {@code parallelism < 1} or {@code drainTimeoutMs < 0}
     */
    public Publisher build() {
      return new Publisher(this);
    }
  }
}
