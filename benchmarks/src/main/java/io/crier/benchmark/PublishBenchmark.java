package io.crier.benchmark;

import io.crier.Event;
import io.crier.MutatingEventHandler;
import io.crier.PublishResult;
import io.crier.Publisher;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Measures blocking publish latency across handler counts and handler kinds.
 *
 * <p>Half of the subscriptions listen to a different event type, so every publish also pays
 * for the type check of handlers it skips.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar PublishBenchmark}
 * <p>Mutating only: {@code java -jar benchmarks/target/benchmarks.jar -p kind=exclusive PublishBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class PublishBenchmark {

  public record BenchEvent(long seq) implements Event {}

  public record OtherEvent(long seq) implements Event {}

  @Param({"1", "8", "64"})
  private int handlers;

  @Param({"shared", "exclusive", "mixed"})
  private String kind;

  @Param({"4"})
  private int parallelism;

  private Publisher publisher;
  private final LongAdder delivered = new LongAdder();
  private long seq;

  @Setup(Level.Trial)
  public void setup() {
    publisher = Publisher.builder().parallelism(parallelism).build();
    for (int i = 0; i < handlers; i++) {
      boolean exclusive = switch (kind) {
        case "shared" -> false;
        case "exclusive" -> true;
        case "mixed" -> i % 2 == 1;
        default -> throw new IllegalArgumentException("Unknown kind: " + kind);
      };
      if (exclusive) {
        publisher.subscribeMut(new Totals());
      } else {
        publisher.subscribeWith(BenchEvent.class, event -> delivered.increment());
      }
      publisher.subscribeWith(OtherEvent.class, event -> delivered.increment());
    }
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    publisher.close();
  }

  @Benchmark
  public void publish(Blackhole bh) {
    PublishResult result = publisher.publish(new BenchEvent(seq++));
    bh.consume(result);
  }

  static final class Totals implements MutatingEventHandler<BenchEvent> {
    private long sum;

    @Override
    public void handle(BenchEvent event) {
      sum += event.seq();
    }
  }
}
