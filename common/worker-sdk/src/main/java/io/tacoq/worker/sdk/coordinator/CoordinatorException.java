package io.tacoq.worker.sdk.coordinator;

import java.util.OptionalInt;

/**
 * Raised when the coordinator answered a request with an error or an unreadable response.
 */
public class CoordinatorException extends RuntimeException {

    private static final int NO_STATUS = -1;

    private final int statusCode;

    public CoordinatorException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public CoordinatorException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_STATUS;
    }

    /**
     * HTTP status of the failed response, empty when the failure happened before or after the exchange.
     */
    public OptionalInt statusCode() {
        return statusCode == NO_STATUS ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
