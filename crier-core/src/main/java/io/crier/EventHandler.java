package io.crier;

import io.crier.util.EventTypes;

import java.util.Objects;

/**
 * Read-only subscriber for events of one type.
 *
 * <p>Shared handlers are fanned out across the publisher's worker pool and may be invoked
 * concurrently, for the same event or for different ones. Implementations must not require
 * exclusive access to their own state; use {@link MutatingEventHandler} for handlers that
 * update internal state.
 *
 * <h2>Declaring the event type</h2>
 * <p>A class implementing {@code EventHandler<OrderPlaced>} needs no further declaration: the
 * default {@link #eventType()} reads the type argument from the class hierarchy. Lambdas and
 * generic implementations cannot be resolved that way; use {@link #of(Class, Callback)} or
 * override {@link #eventType()}.
 *
 * <pre>{@code
 * class AuditHandler implements EventHandler<OrderPlaced> {
 *   public void handle(OrderPlaced event) {
 *     audit.record(event.orderId());
 *   }
 * }
 *
 * publisher.subscribe(new AuditHandler());
 * publisher.subscribe(EventHandler.of(OrderPlaced.class, event -> log(event)));
 * }</pre>
 *
 * @param <E> the event type this handler accepts
 * @see Publisher#subscribe(EventHandler)
 */
public interface EventHandler<E extends Event> {

    /**
     * Handles an event whose runtime class is exactly {@link #eventType()}.
     *
     * @param event the published event
     * @throws Exception if handling fails; recorded as a {@link HandlerFailure}
     */
    void handle(E event) throws Exception;

    /**
     * Returns the event class this handler is bound to.
     *
     * @throws IllegalArgumentException if the type argument cannot be resolved from the
     *     implementing class
     */
    @SuppressWarnings("unchecked")
    default Class<E> eventType() {
        return (Class<E>) EventTypes.resolve(getClass(), EventHandler.class);
    }

    /**
     * Creates a handler bound to {@code eventType} that delegates to {@code callback}.
     */
    static <E extends Event> EventHandler<E> of(Class<E> eventType, Callback<? super E> callback) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(callback, "callback");
        return new EventHandler<>() {
            @Override
            public void handle(E event) throws Exception {
                callback.accept(event);
            }

            @Override
            public Class<E> eventType() {
                return eventType;
            }

            @Override
            public String toString() {
                return "EventHandler[" + eventType.getName() + "]";
            }
        };
    }

    @FunctionalInterface
    interface Callback<E> {
        void accept(E event) throws Exception;
    }
}
