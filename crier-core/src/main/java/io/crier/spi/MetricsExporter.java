package io.crier.spi;

/**
 * Observability hook for exporting publisher counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems. Methods are called
 * from publishing and worker threads and must be thread-safe.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of {@code publish} calls.
     */
    void incrementPublished();

    /**
     * Increments the count of handler invocations that matched and returned normally.
     */
    void incrementHandlerSuccess();

    /**
     * Increments the count of handler invocations that threw.
     */
    void incrementHandlerFailure();

    /**
     * Increments the count of publishes aborted by a poisoned exclusive handler.
     */
    default void incrementPoisoned() {
    }

    /**
     * Records the current number of subscriptions of each kind.
     *
     * @param shared    read-only subscriptions
     * @param exclusive mutating subscriptions
     */
    void recordSubscriptions(int shared, int exclusive);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementPublished() {
        }

        @Override
        public void incrementHandlerSuccess() {
        }

        @Override
        public void incrementHandlerFailure() {
        }

        @Override
        public void recordSubscriptions(int shared, int exclusive) {
        }
    }
}
