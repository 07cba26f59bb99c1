package io.crier.spring.boot;

import io.crier.Event;
import io.crier.EventHandler;
import io.crier.MutatingEventHandler;
import io.crier.Publisher;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EventSubscriberRegistrarTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner();

  @Test
  void subscribesSharedHandler() {
    runner.withUserConfiguration(SharedConfig.class).run(ctx -> {
      var publisher = ctx.getBean(Publisher.class);
      publisher.publish(new Ping(1));
      assertEquals(1, ctx.getBean(PingCounter.class).count.get());
    });
  }

  @Test
  void subscribesMutatingHandler() {
    runner.withUserConfiguration(MutatingConfig.class).run(ctx -> {
      var publisher = ctx.getBean(Publisher.class);
      publisher.publish(new Ping(2));
      publisher.publish(new Ping(3));
      assertEquals(5, ctx.getBean(PingTotals.class).total);
    });
  }

  @Test
  void explicitEventTypeResolvesGenericHandler() {
    runner.withUserConfiguration(GenericConfig.class).run(ctx -> {
      var publisher = ctx.getBean(Publisher.class);
      publisher.publish(new Pong(1));
      publisher.publish(new Ping(1));
      assertEquals(1, ctx.getBean(Forwarder.class).forwarded.get());
    });
  }

  @Test
  void failsWhenBeanImplementsNeither() {
    runner.withUserConfiguration(NotAHandlerConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsWhenBeanImplementsBoth() {
    runner.withUserConfiguration(BothConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsWhenEventTypeCannotBeResolved() {
    runner.withUserConfiguration(UnresolvableConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsWhenEventTypeContradictsDeclaredType() {
    runner.withUserConfiguration(MismatchConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void destroyRemovesSubscriptions() {
    runner.withUserConfiguration(SharedConfig.class).run(ctx -> {
      var publisher = ctx.getBean(Publisher.class);
      assertEquals(1, publisher.subscriptionCount());

      ctx.getBean(EventSubscriberRegistrar.class).destroy();

      assertEquals(0, publisher.subscriptionCount());
    });
  }

  // ── Test support ─────────────────────────────────────────────

  record Ping(int value) implements Event {
  }

  record Pong(int value) implements Event {
  }

  @EventSubscriber
  static class PingCounter implements EventHandler<Ping> {
    final AtomicInteger count = new AtomicInteger();

    @Override
    public void handle(Ping event) {
      count.incrementAndGet();
    }
  }

  @EventSubscriber
  static class PingTotals implements MutatingEventHandler<Ping> {
    int total;

    @Override
    public void handle(Ping event) {
      total += event.value();
    }
  }

  static class Forwarder<E extends Event> implements EventHandler<E> {
    final AtomicInteger forwarded = new AtomicInteger();

    @Override
    public void handle(E event) {
      forwarded.incrementAndGet();
    }
  }

  @EventSubscriber(eventType = Pong.class)
  static class GenericForwarder<E extends Event> extends Forwarder<E> {
  }

  @EventSubscriber
  static class UnresolvableForwarder<E extends Event> extends Forwarder<E> {
  }

  @EventSubscriber
  static class NotAHandler {
  }

  @EventSubscriber
  static class BothKinds implements EventHandler<Ping>, MutatingEventHandler<Ping> {
    @Override
    public void handle(Ping event) {
    }

    @Override
    public Class<Ping> eventType() {
      return Ping.class;
    }
  }

  @EventSubscriber(eventType = Pong.class)
  static class MismatchedHandler implements EventHandler<Ping> {
    @Override
    public void handle(Ping event) {
    }
  }

  @Configuration
  static class BaseConfig {
    @Bean(destroyMethod = "close")
    Publisher publisher() {
      return Publisher.builder().parallelism(2).build();
    }

    @Bean
    EventSubscriberRegistrar registrar(ListableBeanFactory bf, Publisher publisher) {
      return new EventSubscriberRegistrar(bf, publisher);
    }
  }

  @Configuration
  static class SharedConfig extends BaseConfig {
    @Bean
    PingCounter pingCounter() {
      return new PingCounter();
    }
  }

  @Configuration
  static class MutatingConfig extends BaseConfig {
    @Bean
    PingTotals pingTotals() {
      return new PingTotals();
    }
  }

  @Configuration
  static class GenericConfig extends BaseConfig {
    @Bean
    GenericForwarder<Pong> pongForwarder() {
      return new GenericForwarder<>();
    }
  }

  @Configuration
  static class UnresolvableConfig extends BaseConfig {
    @Bean
    UnresolvableForwarder<Pong> unresolvableForwarder() {
      return new UnresolvableForwarder<>();
    }
  }

  @Configuration
  static class NotAHandlerConfig extends BaseConfig {
    @Bean
    NotAHandler notAHandler() {
      return new NotAHandler();
    }
  }

  @Configuration
  static class BothConfig extends BaseConfig {
    @Bean
    BothKinds bothKinds() {
      return new BothKinds();
    }
  }

  @Configuration
  static class MismatchConfig extends BaseConfig {
    @Bean
    MismatchedHandler mismatchedHandler() {
      return new MismatchedHandler();
    }
  }
}
