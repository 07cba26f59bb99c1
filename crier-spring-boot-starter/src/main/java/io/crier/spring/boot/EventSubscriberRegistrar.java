package io.crier.spring.boot;

import io.crier.Event;
import io.crier.EventHandler;
import io.crier.MutatingEventHandler;
import io.crier.Publisher;
import io.crier.util.EventTypes;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Subscribes beans annotated with {@link EventSubscriber} to the {@link Publisher}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}
 * and removes its subscriptions when the context is destroyed.
 *
 * @see EventSubscriber
 */
public class EventSubscriberRegistrar implements SmartInitializingSingleton, DisposableBean {
    private static final Logger logger = Logger.getLogger(EventSubscriberRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final Publisher publisher;
    private final List<Long> subscriptionIds = new ArrayList<>();

    public EventSubscriberRegistrar(ListableBeanFactory beanFactory, Publisher publisher) {
        this.beanFactory = beanFactory;
        this.publisher = publisher;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(EventSubscriber.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            boolean shared = bean instanceof EventHandler;
            boolean mutating = bean instanceof MutatingEventHandler;
            if (shared == mutating) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @EventSubscriber must implement exactly one of "
                                + "EventHandler or MutatingEventHandler, but " + bean.getClass().getName()
                                + (shared ? " implements both" : " implements neither"));
            }

            EventSubscriber annotation = beanFactory.findAnnotationOnBean(beanName, EventSubscriber.class);
            if (annotation == null) {
                // Proxy may hide annotation; try the target class
                annotation = AnnotationUtils.findAnnotation(bean.getClass(), EventSubscriber.class);
            }
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @EventSubscriber annotation on " + bean.getClass().getName());
            }

            long id;
            try {
                id = shared
                        ? subscribeShared(beanName, (EventHandler<?>) bean, annotation.eventType())
                        : subscribeMutating(beanName, (MutatingEventHandler<?>) bean, annotation.eventType());
            } catch (IllegalArgumentException e) {
                throw new BeanCreationException(beanName,
                        "Failed to subscribe @EventSubscriber bean: " + e.getMessage(), e);
            }
            synchronized (subscriptionIds) {
                subscriptionIds.add(id);
            }
            logger.fine("Subscribed bean '" + beanName + "' as subscriptionId=" + id);
        }
    }

    @Override
    public void destroy() {
        List<Long> ids;
        synchronized (subscriptionIds) {
            ids = List.copyOf(subscriptionIds);
            subscriptionIds.clear();
        }
        for (long id : ids) {
            publisher.unsubscribe(id);
        }
    }

    @SuppressWarnings("unchecked")
    private long subscribeShared(String beanName, EventHandler<?> handler, Class<? extends Event> eventType) {
        if (eventType == Event.class) {
            return publisher.subscribe(handler);
        }
        checkDeclaredType(beanName, handler.getClass(), EventHandler.class, eventType);
        EventHandler<Event> target = (EventHandler<Event>) handler;
        return publisher.subscribe(EventHandler.of((Class<Event>) eventType, target::handle));
    }

    @SuppressWarnings("unchecked")
    private long subscribeMutating(String beanName, MutatingEventHandler<?> handler,
            Class<? extends Event> eventType) {
        if (eventType == Event.class) {
            return publisher.subscribeMut(handler);
        }
        checkDeclaredType(beanName, handler.getClass(), MutatingEventHandler.class, eventType);
        MutatingEventHandler<Event> target = (MutatingEventHandler<Event>) handler;
        Class<Event> type = (Class<Event>) eventType;
        return publisher.subscribeMut(new MutatingEventHandler<Event>() {
            @Override
            public void handle(Event event) throws Exception {
                target.handle(event);
            }

            @Override
            public Class<Event> eventType() {
                return type;
            }

            @Override
            public boolean isFaultTolerant() {
                return target.isFaultTolerant();
            }

            @Override
            public String toString() {
                return target.toString();
            }
        });
    }

    // an explicit eventType may only fill in a type the class does not declare
    private static void checkDeclaredType(String beanName, Class<?> beanClass, Class<?> handlerInterface,
            Class<? extends Event> eventType) {
        Class<? extends Event> declared = EventTypes.find(beanClass, handlerInterface);
        if (declared != null && declared != eventType) {
            throw new BeanCreationException(beanName, "@EventSubscriber eventType "
                    + eventType.getName() + " does not match declared type " + declared.getName());
        }
    }
}
