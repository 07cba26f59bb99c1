package io.crier.spring.boot;

import io.crier.Event;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a publisher subscriber.
 *
 * <p>The annotated bean must implement exactly one of {@link io.crier.EventHandler} and
 * {@link io.crier.MutatingEventHandler}. It is subscribed once all singletons are
 * instantiated and unsubscribed when the context shuts down.
 *
 * <pre>{@code
 * @Component
 * @EventSubscriber
 * public class OrderAudit implements EventHandler<OrderPlaced> {
 *   public void handle(OrderPlaced event) { ... }
 * }
 * }</pre>
 *
 * <p>The event type is read from the handler's type argument. Beans whose type argument is
 * not concrete, such as generic forwarding handlers, name it explicitly:
 *
 * <pre>{@code
 * @Bean
 * @EventSubscriber(eventType = OrderPlaced.class)
 * ForwardingHandler<OrderPlaced> orderForwarder(Relay relay) { ... }
 * }</pre>
 *
 * @see EventSubscriberRegistrar
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EventSubscriber {

    /**
     * Event type to subscribe to. Defaults to the handler's declared type argument.
     */
    Class<? extends Event> eventType() default Event.class;
}
