package io.tacoq.broker;

/**
 * Raised when the broker settings cannot be turned into a client, e.g. an unsupported URL scheme.
 */
public class BrokerConfigurationException extends BrokerException {

    public BrokerConfigurationException(String message) {
        super(message);
    }
}
