package io.crier.handler;

import io.crier.Event;
import io.crier.EventEnvelope;
import io.crier.MutatingEventHandler;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Adapts a {@link MutatingEventHandler} to {@link DynamicHandler}, serializing every dispatch
 * through a lock owned by this adapter.
 *
 * <p>The lock is taken before the type check and held until the handler returns. A handler
 * that throws leaves the adapter <em>poisoned</em>: later dispatches, whatever their event
 * type, throw {@link LockPoisonedException} without invoking the handler. A
 * {@linkplain MutatingEventHandler#isFaultTolerant() fault-tolerant} handler is recovered
 * instead, with a warning.
 *
 * <p>A dispatch issued while this handler is {@linkplain HeldHandlers held} by the current
 * publish chain, whether on the same thread or from a worker task that chain is waiting for,
 * is rejected with {@link IllegalStateException} rather than re-entering the handler.
 *
 * @param <E> the handler's event type
 */
public final class ExclusiveHandlerAdapter<E extends Event> implements DynamicHandler {
  private static final Logger logger = Logger.getLogger(ExclusiveHandlerAdapter.class.getName());

  private final MutatingEventHandler<E> handler;
  private final Class<E> eventType;
  private final ReentrantLock lock = new ReentrantLock();

  // guarded by lock
  private Throwable poison;

  /**
   * @param handler the handler to wrap
   * @throws NullPointerException     if {@code handler} or its event type is null
   * @throws IllegalArgumentException if the handler's event type cannot be resolved
   */
  public ExclusiveHandlerAdapter(MutatingEventHandler<E> handler) {
    this.handler = Objects.requireNonNull(handler, "handler");
    this.eventType = Objects.requireNonNull(handler.eventType(), "eventType");
  }

  @Override
  public Class<E> eventType() {
    return eventType;
  }

  @Override
  public boolean dispatch(EventEnvelope envelope) throws Exception {
    if (lock.isHeldByCurrentThread() || HeldHandlers.isHeld(this)) {
      throw new IllegalStateException(
          "Exclusive handler for " + eventType.getName() + " re-entered by its own publish");
    }
    lock.lock();
    HeldHandlers.enter(this);
    try {
      if (poison != null) {
        if (!handler.isFaultTolerant()) {
          throw new LockPoisonedException(eventType, poison);
        }
        logger.log(Level.WARNING, "Recovering fault-tolerant handler for "
            + eventType.getName() + " after earlier fault", poison);
        poison = null;
      }
      E event = envelope.as(eventType);
      if (event == null) {
        return false;
      }
      try {
        handler.handle(event);
      } catch (Throwable t) {
        poison = t;
        throw t;
      }
      return true;
    } finally {
      HeldHandlers.exit(this);
      lock.unlock();
    }
  }

  /**
   * Whether a previous invocation failed and has not been recovered.
   */
  public boolean isPoisoned() {
    lock.lock();
    try {
      return poison != null;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "ExclusiveHandlerAdapter[" + eventType.getName() + " -> " + handler + "]";
  }
}
