package io.crier.registry;

import io.crier.handler.DynamicHandler;

import java.util.Objects;

/**
 * One registry entry.
 *
 * @param id      publisher-unique subscription id, never reused
 * @param kind    scheduling kind
 * @param handler the type-erased handler
 */
public record Subscription(long id, SubscriptionKind kind, DynamicHandler handler) {
  public Subscription {
    if (id < 1) {
      throw new IllegalArgumentException("id must be >= 1");
    }
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(handler, "handler");
  }
}
