package io.crier.registry;

import io.crier.handler.DynamicHandler;

import java.util.List;

/**
 * Holds the subscriptions of one publisher.
 *
 * <p>Implementations must be thread-safe. A snapshot taken by a publish must not be affected
 * by later mutations, and mutations must not wait for a publish in progress.
 *
 * @see DefaultSubscriptionRegistry
 */
public interface SubscriptionRegistry {

  /**
   * Registers a handler and returns its id. Ids start at 1, strictly increase and are never
   * reused, whatever the kind.
   */
  long add(SubscriptionKind kind, DynamicHandler handler);

  /**
   * Removes the subscription with the given id.
   *
   * @return {@code true} if it was present
   */
  boolean remove(long id);

  /**
   * Returns the current subscriptions in id order. The list is immutable.
   */
  List<Subscription> snapshot();

  int size();

  int count(SubscriptionKind kind);

  /**
   * Removes every subscription. The id counter is not reset.
   */
  void clear();
}
