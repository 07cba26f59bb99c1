package io.crier.dispatch;

import io.crier.Event;
import io.crier.EventEnvelope;
import io.crier.HandlerFailure;
import io.crier.PoisonedSubscriptionException;
import io.crier.PublishResult;
import io.crier.handler.HeldHandlers;
import io.crier.handler.LockPoisonedException;
import io.crier.registry.Subscription;
import io.crier.registry.SubscriptionKind;
import io.crier.spi.MetricsExporter;
import io.crier.util.PublisherThreadFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans one published event out to a snapshot of subscriptions.
 *
 * <p>Subscriptions are walked in snapshot order. {@link SubscriptionKind#SHARED} handlers are
 * submitted to a fixed pool of {@code parallelism} daemon workers, with at most
 * {@code parallelism} tasks of one publish in flight: when the budget is used up the
 * publishing thread waits for the oldest task before submitting the next.
 * {@link SubscriptionKind#EXCLUSIVE} handlers run on the publishing thread through their
 * adapter's lock. The call returns once every task of the publish has finished.
 *
 * <p>Handler faults are collected into the {@link PublishResult}; they never abort the walk.
 * Reaching a poisoned exclusive handler does: the remaining in-flight tasks are awaited and
 * {@link PoisonedSubscriptionException} is thrown.
 *
 * <p>A publish issued from one of this dispatcher's own workers runs its shared handlers
 * inline, so nested publishes cannot exhaust the pool. Submitted tasks carry the exclusive
 * handlers their publish holds, so a task cannot block on a lock its own publisher is holding.
 */
public final class FanOutDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(FanOutDispatcher.class.getName());

  private final int parallelism;
  private final MetricsExporter metrics;
  private final long drainTimeoutMs;
  private final PublisherThreadFactory threadFactory;
  private final ExecutorService workers;

  /**
   * @param parallelism    worker count and per-publish in-flight bound, &ge; 1
   * @param metrics        receives success and failure counts
   * @param drainTimeoutMs time {@link #close()} waits for running tasks, &ge; 0
   */
  public FanOutDispatcher(int parallelism, MetricsExporter metrics, long drainTimeoutMs) {
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be >= 1");
    }
    if (drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.parallelism = parallelism;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.drainTimeoutMs = drainTimeoutMs;
    this.threadFactory = new PublisherThreadFactory("crier-publisher-");
    this.workers = Executors.newFixedThreadPool(parallelism, threadFactory);
  }

  public int parallelism() {
    return parallelism;
  }

  /**
   * Delivers {@code envelope} to every matching subscription in {@code subscriptions}.
   *
   * @return {@link PublishResult#delivered()} if no handler failed, otherwise the failures
   *     in the order they were collected
   * @throws PoisonedSubscriptionException if a poisoned exclusive handler was reached
   */
  public PublishResult dispatch(EventEnvelope envelope, List<Subscription> subscriptions) {
    Objects.requireNonNull(envelope, "envelope");
    Objects.requireNonNull(subscriptions, "subscriptions");
    if (subscriptions.isEmpty()) {
      return PublishResult.delivered();
    }

    boolean inline = threadFactory.isWorkerThread();
    List<HandlerFailure> failures = new ArrayList<>();
    Deque<PendingInvocation> inFlight = new ArrayDeque<>();
    PoisonedSubscriptionException fatal = null;

    for (Subscription subscription : subscriptions) {
      if (subscription.kind() == SubscriptionKind.EXCLUSIVE) {
        try {
          invoke(envelope, subscription, failures);
        } catch (LockPoisonedException e) {
          fatal = new PoisonedSubscriptionException(subscription.id(), e.eventType(), e);
          break;
        }
      } else if (inline) {
        invoke(envelope, subscription, failures);
      } else {
        while (inFlight.size() >= parallelism) {
          await(envelope, inFlight.poll(), failures);
        }
        try {
          inFlight.add(new PendingInvocation(subscription,
              workers.submit(HeldHandlers.propagate(
                  () -> subscription.handler().dispatch(envelope)))));
        } catch (RejectedExecutionException e) {
          recordFailure(envelope, subscription, e, failures);
        }
      }
    }
    while (!inFlight.isEmpty()) {
      await(envelope, inFlight.poll(), failures);
    }

    if (fatal != null) {
      for (HandlerFailure failure : failures) {
        fatal.addSuppressed(failure.cause());
      }
      metrics.incrementPoisoned();
      logger.log(Level.SEVERE, "Publish aborted: publishId=" + envelope.publishId()
          + ", subscriptionId=" + fatal.subscriptionId() + " is poisoned", fatal.getCause());
      throw fatal;
    }
    return failures.isEmpty() ? PublishResult.delivered() : PublishResult.failed(failures);
  }

  private void invoke(EventEnvelope envelope, Subscription subscription, List<HandlerFailure> failures) {
    boolean matched;
    try {
      matched = subscription.handler().dispatch(envelope);
    } catch (LockPoisonedException e) {
      if (subscription.kind() == SubscriptionKind.EXCLUSIVE) {
        throw e;
      }
      recordFailure(envelope, subscription, e, failures);
      return;
    } catch (Throwable t) {
      recordFailure(envelope, subscription, t, failures);
      return;
    }
    if (matched) {
      metrics.incrementHandlerSuccess();
    }
  }

  private void await(EventEnvelope envelope, PendingInvocation pending, List<HandlerFailure> failures) {
    boolean matched;
    try {
      matched = getUninterruptibly(pending.future());
    } catch (ExecutionException e) {
      recordFailure(envelope, pending.subscription(), e.getCause(), failures);
      return;
    } catch (CancellationException e) {
      recordFailure(envelope, pending.subscription(), e, failures);
      return;
    }
    if (matched) {
      metrics.incrementHandlerSuccess();
    }
  }

  private static <T> T getUninterruptibly(Future<T> future) throws ExecutionException {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          return future.get();
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private void recordFailure(EventEnvelope envelope, Subscription subscription, Throwable cause,
      List<HandlerFailure> failures) {
    Class<? extends Event> eventType = subscription.handler().eventType();
    failures.add(new HandlerFailure(envelope.publishId(), subscription.id(), subscription.kind(),
        eventType, cause));
    metrics.incrementHandlerFailure();
    logger.log(Level.WARNING, "Handler failed: publishId=" + envelope.publishId()
        + ", subscriptionId=" + subscription.id() + ", eventType=" + eventType.getName(), cause);
  }

  /**
   * Stops the worker pool. Running tasks get {@code drainTimeoutMs} to finish; after that the
   * workers are interrupted and queued tasks are cancelled, which their publishers report as
   * {@link CancellationException} failures. Later submissions are rejected.
   */
  @Override
  public void close() {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded after " + drainTimeoutMs
            + " ms; forcing shutdown");
        cancelQueued(workers.shutdownNow());
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      cancelQueued(workers.shutdownNow());
      Thread.currentThread().interrupt();
    }
  }

  private static void cancelQueued(List<Runnable> queued) {
    for (Runnable task : queued) {
      if (task instanceof Future<?> future) {
        future.cancel(false);
      }
    }
  }

  private record PendingInvocation(Subscription subscription, Future<Boolean> future) {
  }
}
