package io.crier;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.Objects;

/**
 * Type-erased wrapper around one published {@link Event}.
 *
 * <p>One envelope is created per {@link Publisher#publish(Event)} call and shared, read-only,
 * by every handler invocation of that call. Handlers never see the envelope directly: the
 * handler adapters use {@link #as(Class)} to match the event against their declared type.
 *
 * <p>Each envelope carries a monotonic ULID {@code publishId} that correlates log lines and
 * {@link HandlerFailure failure records} belonging to the same publish.
 */
public final class EventEnvelope {
    private final String publishId;
    private final Event event;

    private EventEnvelope(String publishId, Event event) {
        this.publishId = publishId;
        this.event = event;
    }

    /**
     * Wraps an event in a new envelope with a freshly generated publish id.
     *
     * @param event the event to wrap
     * @return a new envelope
     * @throws NullPointerException if {@code event} is null
     */
    public static EventEnvelope of(Event event) {
        Objects.requireNonNull(event, "event");
        return new EventEnvelope(UlidCreator.getMonotonicUlid().toString(), event);
    }

    public String publishId() {
        return publishId;
    }

    public Event event() {
        return event;
    }

    /**
     * Returns the exact runtime class of the wrapped event.
     */
    public Class<? extends Event> type() {
        return event.getClass();
    }

    /**
     * Exact-type downcast of the wrapped event.
     *
     * @param type the expected event class
     * @param <T> the expected event type
     * @return the event cast to {@code type}, or {@code null} if its runtime class is not
     *     exactly {@code type}
     */
    public <T> T as(Class<T> type) {
        Objects.requireNonNull(type, "type");
        return event.getClass() == type ? type.cast(event) : null;
    }

    @Override
    public String toString() {
        return "EventEnvelope{publishId=" + publishId + ", type=" + type().getName() + "}";
    }
}
