package io.tacoq.worker.sdk.coordinator;

/**
 * Raised when no response could be obtained from the coordinator.
 */
public class CoordinatorConnectionException extends CoordinatorException {

    public CoordinatorConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
