package io.crier.registry;

/**
 * How a subscribed handler is scheduled.
 */
public enum SubscriptionKind {
    /** Read-only handler; may run concurrently on the worker pool. */
    SHARED,
    /** Mutating handler; runs on the publishing thread under its own lock. */
    EXCLUSIVE
}
