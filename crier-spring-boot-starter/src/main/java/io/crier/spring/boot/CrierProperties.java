package io.crier.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the publisher.
 *
 * @see CrierAutoConfiguration
 */
@ConfigurationProperties(prefix = "crier")
public class CrierProperties {

    private final Publisher publisher = new Publisher();
    private final Metrics metrics = new Metrics();

    public Publisher getPublisher() {
        return publisher;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Publisher {
        /**
         * Worker threads, and the maximum number of read-only handlers one publish runs at
         * the same time. 0 uses the number of available processors.
         */
        private int parallelism = 0;

        /**
         * Time in milliseconds to wait for running handlers on shutdown.
         */
        private long drainTimeoutMs = 5000;

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Metrics {
        /**
         * Whether to export publisher metrics through Micrometer.
         */
        private boolean enabled = true;

        /**
         * Prefix for all meter names.
         */
        private String namePrefix = "crier";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
