package io.tacoq.broker;

/**
 * Creates a {@link BrokerClient} bound to one worker identity.
 */
@FunctionalInterface
public interface BrokerClientFactory {

    BrokerClient create(String workerId);
}
