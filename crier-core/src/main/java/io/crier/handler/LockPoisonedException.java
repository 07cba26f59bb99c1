package io.crier.handler;

import io.crier.Event;

/**
 * Signals that an {@link ExclusiveHandlerAdapter} was reached after its handler failed.
 * The cause is the original handler fault.
 */
public class LockPoisonedException extends RuntimeException {

  private final Class<? extends Event> eventType;

  public LockPoisonedException(Class<? extends Event> eventType, Throwable cause) {
    super("Handler for " + eventType.getName() + " failed earlier; its state may be inconsistent",
        cause);
    this.eventType = eventType;
  }

  public Class<? extends Event> eventType() {
    return eventType;
  }
}
