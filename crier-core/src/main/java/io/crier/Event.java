package io.crier;

/**
 * Marker for values that can be published through a {@link Publisher}.
 *
 * <p>An event is identified at dispatch time solely by its runtime class. Handlers bound
 * to a class receive events of exactly that class; subclasses and sibling implementations
 * are not matched.
 *
 * <p>The same instance is handed to every matching handler, possibly on several threads
 * at once, so implementations must be immutable and must not hold references to mutable
 * state owned by a shorter-lived scope. Records are the natural fit:
 *
 * <pre>{@code
 * public record OrderPlaced(String orderId, long amountCents) implements Event {}
 * }</pre>
 *
 * @see EventEnvelope
 * @see EventHandler
 */
public interface Event {
}
