package io.crier.util;

import io.crier.Event;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Resolves the event type argument a handler class declares for a handler interface.
 *
 * <p>Given {@code class Audit implements EventHandler<OrderPlaced>}, resolving
 * {@code Audit.class} against {@code EventHandler.class} yields {@code OrderPlaced.class}.
 * Superclasses and sub-interfaces are searched. Type arguments that are type variables, as
 * well as lambdas (whose classes carry no generic signature), are not resolvable.
 */
public final class EventTypes {

    private EventTypes() {
    }

    /**
     * @param implementation   the handler's runtime class
     * @param handlerInterface the generic handler interface, whose first type argument is
     *                         the event type
     * @return the declared event class
     * @throws IllegalArgumentException if no concrete event type argument is declared
     */
    public static Class<? extends Event> resolve(Class<?> implementation, Class<?> handlerInterface) {
        Class<? extends Event> found = find(implementation, handlerInterface);
        if (found == null) {
            throw new IllegalArgumentException("Cannot resolve the event type of "
                    + implementation.getName() + " for " + handlerInterface.getSimpleName()
                    + "; override eventType() or declare the type explicitly");
        }
        return found;
    }

    /**
     * Like {@link #resolve(Class, Class)}, but returns {@code null} if no concrete event type
     * argument is declared.
     */
    public static Class<? extends Event> find(Class<?> implementation, Class<?> handlerInterface) {
        Objects.requireNonNull(implementation, "implementation");
        Objects.requireNonNull(handlerInterface, "handlerInterface");
        for (Class<?> c = implementation; c != null && c != Object.class; c = c.getSuperclass()) {
            Class<? extends Event> found = fromInterfaces(c.getGenericInterfaces(), handlerInterface);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static Class<? extends Event> fromInterfaces(Type[] interfaces, Class<?> target) {
        for (Type type : interfaces) {
            Class<?> raw;
            if (type instanceof ParameterizedType parameterized) {
                raw = (Class<?>) parameterized.getRawType();
                if (raw == target) {
                    Type argument = parameterized.getActualTypeArguments()[0];
                    if (argument instanceof Class<?> eventClass && Event.class.isAssignableFrom(eventClass)) {
                        return eventClass.asSubclass(Event.class);
                    }
                    return null;
                }
            } else {
                raw = (Class<?>) type;
            }
            if (raw != target && target.isAssignableFrom(raw)) {
                Class<? extends Event> found = fromInterfaces(raw.getGenericInterfaces(), target);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }
}
