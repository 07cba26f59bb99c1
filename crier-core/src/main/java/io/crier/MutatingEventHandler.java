package io.crier;

import io.crier.util.EventTypes;

/**
 * Subscriber for events of one type that updates its own state while handling them.
 *
 * <p>Mutating handlers are invoked on the publishing thread while holding a lock private to
 * the handler, so an instance never runs concurrently with itself, even when several threads
 * publish at the same time.
 *
 * <h2>Faults</h2>
 * <p>If {@link #handle} throws, the failure is reported in the {@link PublishResult} and the
 * handler becomes <em>poisoned</em>: its state may be half-updated. Every later publish that
 * reaches a poisoned handler throws {@link PoisonedSubscriptionException} until the handler is
 * unsubscribed. Handlers whose state stays consistent after a fault return {@code true} from
 * {@link #isFaultTolerant()} and are recovered instead.
 *
 * <pre>{@code
 * class OrderCounter implements MutatingEventHandler<OrderPlaced> {
 *   private long count;
 *
 *   public void handle(OrderPlaced event) {
 *     count++;
 *   }
 * }
 *
 * publisher.subscribeMut(new OrderCounter());
 * }</pre>
 *
 * @param <E> the event type this handler accepts
 * @see Publisher#subscribeMut(MutatingEventHandler)
 */
public interface MutatingEventHandler<E extends Event> {

    /**
     * Handles an event whose runtime class is exactly {@link #eventType()}.
     *
     * @param event the published event
     * @throws Exception if handling fails; recorded as a {@link HandlerFailure} and poisons
     *     the handler
     */
    void handle(E event) throws Exception;

    /**
     * Returns the event class this handler is bound to. Resolved from the implementing class
     * unless overridden.
     */
    @SuppressWarnings("unchecked")
    default Class<E> eventType() {
        return (Class<E>) EventTypes.resolve(getClass(), MutatingEventHandler.class);
    }

    /**
     * Whether the handler's state remains valid after {@link #handle} threw.
     *
     * @return {@code false} by default
     */
    default boolean isFaultTolerant() {
        return false;
    }
}
