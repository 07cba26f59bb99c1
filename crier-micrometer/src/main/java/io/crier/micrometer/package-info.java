/**
 * Micrometer bridge for exporting publisher metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.crier.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.crier.spi.MetricsExporter} SPI using Micrometer counters and gauges.
 *
 * @see io.crier.micrometer.MicrometerMetricsExporter
 */
package io.crier.micrometer;
