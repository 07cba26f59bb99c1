/**
 * In-process typed publish/subscribe.
 *
 * <p>Events are immutable {@link io.crier.Event} values. A {@link io.crier.Publisher} delivers
 * each published event to the handlers subscribed to its exact runtime class:
 * {@link io.crier.EventHandler}s in parallel on a bounded worker pool and
 * {@link io.crier.MutatingEventHandler}s one at a time under a per-handler lock. Handler
 * faults are isolated and returned as a {@link io.crier.PublishResult}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>crier-core</b>: publisher, handlers, registry, dispatcher (depends only on
 *       ulid-creator)</li>
 *   <li><b>crier-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>crier-spring-boot-starter</b>: auto-configuration and {@code @EventSubscriber}
 *       beans</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * record OrderPlaced(String orderId, long amountCents) implements Event {}
 *
 * try (Publisher publisher = Publisher.create()) {
 *     publisher.subscribeWith(OrderPlaced.class, e -> System.out.println("Placed " + e.orderId()));
 *     publisher.publish(new OrderPlaced("order-123", 9999)).throwIfFailed();
 * }
 * }</pre>
 *
 * @see io.crier.Publisher
 * @see io.crier.EventHandler
 * @see io.crier.MutatingEventHandler
 * @see io.crier.PublishResult
 */
package io.crier;
