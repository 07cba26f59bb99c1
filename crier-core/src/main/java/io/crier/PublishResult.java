package io.crier;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link Publisher#publish(Event)}.
 *
 * <ul>
 *   <li>{@link Delivered}: every matching handler returned normally (including the case
 *       where no handler matched).</li>
 *   <li>{@link Failed}: at least one handler threw; carries one {@link HandlerFailure}
 *       per failed handler. Handlers that did not fail still ran.</li>
 * </ul>
 *
 * <p>The publisher never retries. Callers decide whether to log, republish, or treat a
 * failure as fatal, for example via {@link #throwIfFailed()}.
 */
public sealed interface PublishResult permits PublishResult.Delivered, PublishResult.Failed {

    /**
     * Singleton indicating that no handler failed.
     */
    Delivered DELIVERED = new Delivered();

    static Delivered delivered() {
        return DELIVERED;
    }

    /**
     * Creates a failed result.
     *
     * @param failures the captured failures, in collection order
     * @return a failed result holding an immutable copy of {@code failures}
     * @throws NullPointerException     if {@code failures} is null
     * @throws IllegalArgumentException if {@code failures} is empty
     */
    static Failed failed(List<HandlerFailure> failures) {
        return new Failed(failures);
    }

    boolean isSuccess();

    /**
     * Returns the captured failures; empty for {@link Delivered}.
     */
    List<HandlerFailure> failures();

    /**
     * Throws if this result is {@link Failed}.
     *
     * @throws PublishFailedException carrying the failures, each cause attached as suppressed
     */
    default void throwIfFailed() {
        if (!isSuccess()) {
            throw new PublishFailedException(failures());
        }
    }

    /**
     * No handler failed.
     */
    record Delivered() implements PublishResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public List<HandlerFailure> failures() {
            return List.of();
        }
    }

    /**
     * At least one handler failed.
     *
     * @param failures the captured failures (never empty)
     */
    record Failed(List<HandlerFailure> failures) implements PublishResult {
        public Failed {
            Objects.requireNonNull(failures, "failures must not be null");
            if (failures.isEmpty()) {
                throw new IllegalArgumentException("failures must not be empty");
            }
            failures = List.copyOf(failures);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
