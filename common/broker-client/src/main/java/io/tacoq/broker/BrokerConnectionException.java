package io.tacoq.broker;

/**
 * Raised when the broker cannot be reached, rejects the session or drops an open stream.
 */
public class BrokerConnectionException extends BrokerException {

    public BrokerConnectionException(String message) {
        super(message);
    }

    public BrokerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
