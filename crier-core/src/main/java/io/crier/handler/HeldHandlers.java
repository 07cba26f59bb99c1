package io.crier.handler;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Tracks which exclusive handlers the current publish chain is holding.
 *
 * <p>A chain starts on the publishing thread and follows every task that thread submits while
 * it holds an exclusive handler: such a task runs while the lock is still held, since the
 * publisher waits for it before the handler returns. An exclusive handler that finds itself in
 * the chain's set would wait on its own holder, so it is rejected instead.
 */
public final class HeldHandlers {
  private static final ThreadLocal<Set<DynamicHandler>> HELD = new ThreadLocal<>();

  private HeldHandlers() {
  }

  /**
   * Whether {@code handler} is held by the current thread or by the publish that submitted the
   * task it is running.
   */
  public static boolean isHeld(DynamicHandler handler) {
    Set<DynamicHandler> held = HELD.get();
    return held != null && held.contains(handler);
  }

  static void enter(DynamicHandler handler) {
    Set<DynamicHandler> held = HELD.get();
    if (held == null) {
      held = newSet();
      HELD.set(held);
    }
    held.add(handler);
  }

  static void exit(DynamicHandler handler) {
    Set<DynamicHandler> held = HELD.get();
    if (held == null) {
      return;
    }
    held.remove(handler);
    if (held.isEmpty()) {
      HELD.remove();
    }
  }

  /**
   * Wraps {@code task} so that, wherever it runs, it sees the handlers held by the calling
   * thread at the time of this call. The worker's own state is restored afterwards.
   */
  public static <T> Callable<T> propagate(Callable<T> task) {
    Set<DynamicHandler> current = HELD.get();
    if (current == null || current.isEmpty()) {
      return task;
    }
    Set<DynamicHandler> captured = newSet();
    captured.addAll(current);
    return () -> {
      Set<DynamicHandler> previous = HELD.get();
      Set<DynamicHandler> installed = newSet();
      installed.addAll(captured);
      HELD.set(installed);
      try {
        return task.call();
      } finally {
        if (previous == null) {
          HELD.remove();
        } else {
          HELD.set(previous);
        }
      }
    };
  }

  private static Set<DynamicHandler> newSet() {
    return Collections.newSetFromMap(new IdentityHashMap<>());
  }
}
