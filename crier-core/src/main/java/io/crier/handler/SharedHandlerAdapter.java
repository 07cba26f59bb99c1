package io.crier.handler;

import io.crier.Event;
import io.crier.EventEnvelope;
import io.crier.EventHandler;

import java.util.Objects;

/**
 * Adapts an {@link EventHandler} to {@link DynamicHandler}. Holds no lock; safe to dispatch
 * from several threads at once as long as the wrapped handler is.
 *
 * @param <E> the handler's event type
 */
public final class SharedHandlerAdapter<E extends Event> implements DynamicHandler {
  private final EventHandler<E> handler;
  private final Class<E> eventType;

  /**
   * @param handler the handler to wrap
   * @throws NullPointerException     if {@code handler} or its event type is null
   * @throws IllegalArgumentException if the handler's event type cannot be resolved
   */
  public SharedHandlerAdapter(EventHandler<E> handler) {
    this.handler = Objects.requireNonNull(handler, "handler");
    this.eventType = Objects.requireNonNull(handler.eventType(), "eventType");
  }

  @Override
  public Class<E> eventType() {
    return eventType;
  }

  @Override
  public boolean dispatch(EventEnvelope envelope) throws Exception {
    E event = envelope.as(eventType);
    if (event == null) {
      return false;
    }
    handler.handle(event);
    return true;
  }

  @Override
  public String toString() {
    return "SharedHandlerAdapter[" + eventType.getName() + " -> " + handler + "]";
  }
}
