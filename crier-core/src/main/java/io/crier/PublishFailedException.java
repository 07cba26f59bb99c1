package io.crier;

import java.util.List;

/**
 * Thrown by {@link PublishResult#throwIfFailed()} when one or more handlers failed.
 *
 * <p>Each failure's cause is attached as a suppressed exception, so a single stack trace
 * shows every handler fault of the publish.
 */
public class PublishFailedException extends CrierException {

    private final List<HandlerFailure> failures;

    /**
     * @param failures the failures of one publish; must not be empty
     * @throws IllegalArgumentException if {@code failures} is empty
     */
    public PublishFailedException(List<HandlerFailure> failures) {
        super(describe(failures));
        this.failures = List.copyOf(failures);
        for (HandlerFailure failure : this.failures) {
            addSuppressed(failure.cause());
        }
    }

    public List<HandlerFailure> failures() {
        return failures;
    }

    private static String describe(List<HandlerFailure> failures) {
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("failures must not be empty");
        }
        return failures.size() + " handler(s) failed for publishId=" + failures.get(0).publishId();
    }
}
