package io.crier;

/**
 * Thrown by {@link Publisher#publish(Event)} when it reaches a {@link MutatingEventHandler}
 * that failed in an earlier invocation and is not fault tolerant.
 *
 * <p>The handler's state may be inconsistent, so the publish stops invoking further handlers.
 * Shared handlers already running are awaited first; failures they produced are attached as
 * suppressed exceptions. The handler stays poisoned until the subscription is removed with
 * {@link Publisher#unsubscribeMut(long)}.
 *
 * @see MutatingEventHandler#isFaultTolerant()
 */
public class PoisonedSubscriptionException extends CrierException {

    private final long subscriptionId;
    private final Class<? extends Event> eventType;

    /**
     * @param subscriptionId the poisoned subscription
     * @param eventType      the event type the handler is bound to
     * @param cause          the poisoning signal; its own cause is the original handler fault
     */
    public PoisonedSubscriptionException(long subscriptionId, Class<? extends Event> eventType,
            Throwable cause) {
        super("Exclusive handler subscriptionId=" + subscriptionId + " for "
                + eventType.getName() + " is poisoned by an earlier fault", cause);
        this.subscriptionId = subscriptionId;
        this.eventType = eventType;
    }

    public long subscriptionId() {
        return subscriptionId;
    }

    public Class<? extends Event> eventType() {
        return eventType;
    }
}
