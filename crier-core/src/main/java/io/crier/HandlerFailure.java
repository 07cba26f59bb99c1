package io.crier;

import io.crier.registry.SubscriptionKind;

import java.util.Objects;

/**
 * One handler's abnormal termination during a publish.
 *
 * @param publishId      the {@link EventEnvelope#publishId() publish id} of the failed publish
 * @param subscriptionId id of the failed subscription
 * @param kind           whether the handler was shared or exclusive
 * @param eventType      the event type the handler is bound to
 * @param cause          what the handler threw
 */
public record HandlerFailure(
    String publishId,
    long subscriptionId,
    SubscriptionKind kind,
    Class<? extends Event> eventType,
    Throwable cause
) {
  public HandlerFailure {
    Objects.requireNonNull(publishId, "publishId");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(cause, "cause");
  }
}
