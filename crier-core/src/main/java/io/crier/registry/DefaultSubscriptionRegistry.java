package io.crier.registry;

import io.crier.handler.DynamicHandler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Copy-on-write registry.
 *
 * <p>Mutations take a private lock, allocate the id and republish an immutable snapshot
 * through a volatile field. {@link #snapshot()} never locks.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SubscriptionRegistry registry = new DefaultSubscriptionRegistry();
 * long id = registry.add(SubscriptionKind.SHARED, new SharedHandlerAdapter<>(handler));
 * for (Subscription s : registry.snapshot()) {
 *   s.handler().dispatch(envelope);
 * }
 * registry.remove(id);
 * }</pre>
 */
public final class DefaultSubscriptionRegistry implements SubscriptionRegistry {
  private final Object lock = new Object();
  private final Map<Long, Subscription> entries = new LinkedHashMap<>();
  private long lastId;
  private volatile List<Subscription> snapshot = List.of();

  @Override
  public long add(SubscriptionKind kind, DynamicHandler handler) {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(handler, "handler");
    synchronized (lock) {
      long id = ++lastId;
      entries.put(id, new Subscription(id, kind, handler));
      republish();
      return id;
    }
  }

  @Override
  public boolean remove(long id) {
    synchronized (lock) {
      if (entries.remove(id) == null) {
        return false;
      }
      republish();
      return true;
    }
  }

  @Override
  public List<Subscription> snapshot() {
    return snapshot;
  }

  @Override
  public int size() {
    return snapshot.size();
  }

  @Override
  public int count(SubscriptionKind kind) {
    Objects.requireNonNull(kind, "kind");
    int n = 0;
    for (Subscription s : snapshot) {
      if (s.kind() == kind) {
        n++;
      }
    }
    return n;
  }

  @Override
  public void clear() {
    synchronized (lock) {
      entries.clear();
      republish();
    }
  }

  // insertion order is id order since ids only grow
  private void republish() {
    snapshot = List.copyOf(entries.values());
  }
}
