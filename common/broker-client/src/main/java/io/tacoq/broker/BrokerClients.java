package io.tacoq.broker;

import io.tacoq.broker.rabbit.RabbitBrokerClient;
import io.tacoq.broker.redis.RedisBrokerClient;
import java.util.Objects;

/**
 * Selects the transport backend from the broker URL scheme.
 *
 * <p>The choice is made without any network I/O, so a misconfigured URL fails before the worker
 * registers with the coordinator.</p>
 */
public final class BrokerClients {

    private BrokerClients() {
    }

    /**
     * Resolves the backend for {@code config}.
     *
     * @throws BrokerConfigurationException when the URL is missing or its scheme is not supported
     */
    public static BrokerClientFactory factoryFor(BrokerConfig config) {
        Objects.requireNonNull(config, "config");
        String scheme = config.scheme();
        if (scheme == null) {
            throw new BrokerConfigurationException(
                "Broker URL must be an absolute URL with a scheme: " + config.redactedUrl());
        }
        return switch (scheme) {
            case "amqp", "amqps" -> workerId -> new RabbitBrokerClient(config, workerId);
            case "redis", "rediss" -> workerId -> new RedisBrokerClient(config, workerId);
            default -> throw new BrokerConfigurationException(
                "Unsupported broker URL scheme '%s' (expected amqp, amqps, redis or rediss)".formatted(scheme));
        };
    }
}
