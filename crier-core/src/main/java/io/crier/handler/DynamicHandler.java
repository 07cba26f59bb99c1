package io.crier.handler;

import io.crier.Event;
import io.crier.EventEnvelope;

/**
 * Type-erased view of a subscribed handler.
 *
 * <p>The registry stores handlers of unrelated event types side by side through this
 * interface. Each implementation closes over its declared event type and decides on every
 * dispatch whether the envelope's event matches it.
 */
public interface DynamicHandler {

  /**
   * Returns the event class the wrapped handler is bound to.
   */
  Class<? extends Event> eventType();

  /**
   * Invokes the wrapped handler if the envelope's event is exactly of {@link #eventType()}.
   *
   * @param envelope the published event
   * @return {@code true} if the handler matched and returned normally, {@code false} on a
   *     type mismatch
   * @throws Exception whatever the wrapped handler throws
   */
  boolean dispatch(EventEnvelope envelope) throws Exception;
}
