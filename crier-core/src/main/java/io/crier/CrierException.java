package io.crier;

/**
 * Base class for unchecked exceptions raised by the publisher itself, as opposed to
 * exceptions thrown by handlers.
 */
public class CrierException extends RuntimeException {

    public CrierException(String message) {
        super(message);
    }

    public CrierException(String message, Throwable cause) {
        super(message, cause);
    }
}
