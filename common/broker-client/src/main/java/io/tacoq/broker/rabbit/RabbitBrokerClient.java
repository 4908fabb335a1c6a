package io.tacoq.broker.rabbit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import io.tacoq.broker.BrokerClient;
import io.tacoq.broker.BrokerConfig;
import io.tacoq.broker.BrokerConfigurationException;
import io.tacoq.broker.BrokerConnectionException;
import io.tacoq.broker.TaskStream;
import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BrokerClient} backed by a RabbitMQ exchange/queue topology.
 *
 * <p>Every task kind maps to a durable direct exchange named after the kind. The worker consumes
 * from its own queue {@code <workerId>.<kind>}, bound with the worker id as routing key (work
 * addressed to this worker) and with the kind as routing key (work fanned out by kind). Deliveries
 * are acknowledged only after the caller processed them, so a crash mid-task leaves the message for
 * redelivery.</p>
 */
public final class RabbitBrokerClient implements BrokerClient {

    private static final Logger log = LoggerFactory.getLogger(RabbitBrokerClient.class);

    private final BrokerConfig config;
    private final String workerId;
    private final ConnectionFactory connectionFactory;
    private final RabbitDeliveryDecoder decoder;
    private final List<RabbitTaskStream> streams = new CopyOnWriteArrayList<>();
    private final Set<String> ownedQueues = ConcurrentHashMap.newKeySet();
    private final Set<String> kindExchanges = ConcurrentHashMap.newKeySet();

    private volatile Connection connection;
    private volatile boolean disconnected;

    public RabbitBrokerClient(BrokerConfig config, String workerId) {
        this(config, workerId, new ConnectionFactory(), new ObjectMapper());
    }

    RabbitBrokerClient(BrokerConfig config,
                       String workerId,
                       ConnectionFactory connectionFactory,
                       ObjectMapper mapper) {
        this.config = Objects.requireNonNull(config, "config");
        this.workerId = requireText(workerId, "workerId");
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.decoder = new RabbitDeliveryDecoder(Objects.requireNonNull(mapper, "mapper"));
    }

    @Override
    public synchronized void connect() {
        if (connection != null && connection.isOpen()) {
            return;
        }
        if (disconnected) {
            throw new IllegalStateException("Broker client for worker " + workerId + " was already disconnected");
        }
        try {
            connectionFactory.setUri(config.url());
        } catch (URISyntaxException | GeneralSecurityException | IllegalArgumentException ex) {
            throw new BrokerConfigurationException("Invalid AMQP URL " + config.redactedUrl() + ": " + ex.getMessage());
        }
        connectionFactory.setConnectionTimeout((int) config.connectTimeout().toMillis());
        // a dropped connection must end the streams instead of silently recovering
        connectionFactory.setAutomaticRecoveryEnabled(false);
        Connection newConnection = null;
        try {
            newConnection = connectionFactory.newConnection("tacoq-worker-" + workerId);
            if (config.exchange() != null) {
                declareSubmissionExchange(newConnection, config.exchange());
            }
            this.connection = newConnection;
        } catch (IOException | TimeoutException | RuntimeException ex) {
            closeQuietly(newConnection);
            throw new BrokerConnectionException("Failed to connect to AMQP broker " + config.redactedUrl(), ex);
        }
        if (log.isInfoEnabled()) {
            log.info("Connected to AMQP broker {} (worker={})", config.redactedUrl(), workerId);
        }
    }

    private static void declareSubmissionExchange(Connection connection, String exchange) throws IOException, TimeoutException {
        Channel channel = connection.createChannel();
        try {
            channel.exchangeDeclare(exchange, BuiltinExchangeType.DIRECT, true);
        } finally {
            channel.close();
        }
    }

    @Override
    public TaskStream consume(String taskKind) {
        String kind = requireText(taskKind, "taskKind");
        Connection current = requireConnection();
        String queue = queueName(kind);
        Channel channel = null;
        try {
            channel = current.createChannel();
            channel.basicQos(1);
            channel.exchangeDeclare(kind, BuiltinExchangeType.DIRECT, true);
            channel.queueDeclare(queue, false, false, false, Map.of());
            channel.queueBind(queue, kind, workerId);
            channel.queueBind(queue, kind, kind);
            kindExchanges.add(kind);
            ownedQueues.add(queue);
            RabbitTaskStream stream = new RabbitTaskStream(kind, channel, queue, decoder);
            stream.start();
            streams.add(stream);
            log.info("Consuming task kind {} from queue {} (worker={})", kind, queue, workerId);
            return stream;
        } catch (IOException | RuntimeException ex) {
            closeQuietly(channel);
            throw new BrokerConnectionException("Failed to consume task kind " + kind + " from queue " + queue, ex);
        }
    }

    @Override
    public synchronized void disconnect() {
        Connection current = connection;
        if (current == null || disconnected) {
            return;
        }
        disconnected = true;
        streams.forEach(RabbitTaskStream::close);
        streams.clear();
        if (current.isOpen()) {
            ownedQueues.forEach(queue -> bestEffort(current, "delete queue " + queue, channel -> channel.queueDelete(queue)));
            kindExchanges.forEach(exchange -> bestEffort(current, "delete exchange " + exchange,
                channel -> channel.exchangeDelete(exchange, true)));
        }
        closeQuietly(current);
        connection = null;
        if (log.isInfoEnabled()) {
            log.info("Disconnected from AMQP broker {} (worker={})", config.redactedUrl(), workerId);
        }
    }

    @Override
    public String workerId() {
        return workerId;
    }

    String queueName(String taskKind) {
        return workerId + "." + taskKind;
    }

    private Connection requireConnection() {
        Connection current = connection;
        if (current == null || disconnected) {
            throw new IllegalStateException("Broker client for worker " + workerId + " is not connected");
        }
        if (!current.isOpen()) {
            throw new BrokerConnectionException("AMQP connection for worker " + workerId + " is closed");
        }
        return current;
    }

    // Each teardown step gets its own channel: a failed exchangeDelete closes the channel it ran on.
    private static void bestEffort(Connection connection, String description, ChannelAction action) {
        Channel channel = null;
        try {
            channel = connection.createChannel();
            action.apply(channel);
        } catch (Exception ex) {
            log.warn("Broker teardown step failed: {} ({})", description, ex.getMessage());
        } finally {
            closeQuietly(channel);
        }
    }

    static void closeQuietly(Channel channel) {
        if (channel == null) {
            return;
        }
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (Exception ex) {
            log.debug("Ignoring failure while closing AMQP channel", ex);
        }
    }

    private static void closeQuietly(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            if (connection.isOpen()) {
                connection.close();
            }
        } catch (Exception ex) {
            log.warn("Failed to close AMQP connection cleanly: {}", ex.getMessage());
        }
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
        return value;
    }

    @FunctionalInterface
    private interface ChannelAction {
        void apply(Channel channel) throws IOException;
    }
}
