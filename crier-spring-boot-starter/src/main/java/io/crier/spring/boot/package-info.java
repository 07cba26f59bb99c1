/**
 * Spring Boot auto-configuration for the publisher.
 *
 * <h2>Properties</h2>
 * <ul>
 *   <li>{@code crier.publisher.parallelism}: worker count, 0 for available processors</li>
 *   <li>{@code crier.publisher.drain-timeout-ms}: shutdown drain timeout</li>
 *   <li>{@code crier.metrics.enabled}: Micrometer export on or off</li>
 *   <li>{@code crier.metrics.name-prefix}: meter name prefix</li>
 * </ul>
 *
 * @see io.crier.spring.boot.CrierAutoConfiguration
 * @see io.crier.spring.boot.EventSubscriber
 */
package io.crier.spring.boot;
