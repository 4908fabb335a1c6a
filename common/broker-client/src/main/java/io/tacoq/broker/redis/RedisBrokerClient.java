package io.tacoq.broker.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.pubsub.RedisPubSubAdapter;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import io.tacoq.broker.BrokerClient;
import io.tacoq.broker.BrokerConfig;
import io.tacoq.broker.BrokerConfigurationException;
import io.tacoq.broker.BrokerConnectionException;
import io.tacoq.broker.TaskStream;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BrokerClient} backed by Redis publish/subscribe.
 *
 * <p>For each task kind the worker subscribes to {@code <namespace>:<kind>} (work fanned out by
 * kind) and {@code <namespace>:<kind>:<workerId>} (work addressed to this worker). Pub/sub has no
 * acknowledgement or redelivery: a message published while no subscriber is connected, or arriving
 * while the local buffer is full, is lost.</p>
 */
public final class RedisBrokerClient implements BrokerClient {

    private static final Logger log = LoggerFactory.getLogger(RedisBrokerClient.class);
    static final int DEFAULT_BUFFER_CAPACITY = 256;

    private final BrokerConfig config;
    private final String workerId;
    private final RedisTransportFactory transportFactory;
    private final RedisMessageDecoder decoder;
    private final int bufferCapacity;
    private final List<RedisTaskStream> streams = new CopyOnWriteArrayList<>();

    private volatile RedisTransport transport;
    private volatile boolean disconnected;

    public RedisBrokerClient(BrokerConfig config, String workerId) {
        this(config, workerId, new LettuceRedisTransportFactory(), new ObjectMapper(), DEFAULT_BUFFER_CAPACITY);
    }

    RedisBrokerClient(BrokerConfig config,
                      String workerId,
                      RedisTransportFactory transportFactory,
                      ObjectMapper mapper,
                      int bufferCapacity) {
        this.config = Objects.requireNonNull(config, "config");
        this.workerId = requireText(workerId, "workerId");
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.decoder = new RedisMessageDecoder(Objects.requireNonNull(mapper, "mapper"));
        if (bufferCapacity < 1) {
            throw new IllegalArgumentException("bufferCapacity must be positive");
        }
        this.bufferCapacity = bufferCapacity;
    }

    @Override
    public synchronized void connect() {
        if (transport != null) {
            return;
        }
        if (disconnected) {
            throw new IllegalStateException("Broker client for worker " + workerId + " was already disconnected");
        }
        RedisTransport created;
        try {
            created = transportFactory.connect(config);
        } catch (BrokerConfigurationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new BrokerConnectionException("Failed to connect to Redis broker " + config.redactedUrl(), ex);
        }
        this.transport = created;
        if (log.isInfoEnabled()) {
            log.info("Connected to Redis broker {} (worker={})", config.redactedUrl(), workerId);
        }
    }

    @Override
    public TaskStream consume(String taskKind) {
        String kind = requireText(taskKind, "taskKind");
        RedisTransport current = transport;
        if (current == null || disconnected) {
            throw new IllegalStateException("Broker client for worker " + workerId + " is not connected");
        }
        List<String> channels = channelsFor(kind);
        RedisTaskStream stream = new RedisTaskStream(kind, decoder, bufferCapacity);
        try {
            stream.attach(current.subscribe(channels, stream::onMessage));
        } catch (RuntimeException ex) {
            throw new BrokerConnectionException("Failed to subscribe to " + channels, ex);
        }
        streams.add(stream);
        log.info("Consuming task kind {} from channels {} (worker={})", kind, channels, workerId);
        return stream;
    }

    @Override
    public synchronized void disconnect() {
        RedisTransport current = transport;
        if (current == null || disconnected) {
            return;
        }
        disconnected = true;
        streams.forEach(RedisTaskStream::close);
        streams.clear();
        try {
            current.shutdown();
        } catch (RuntimeException ex) {
            log.warn("Failed to shut down Redis client cleanly: {}", ex.getMessage());
        }
        transport = null;
        if (log.isInfoEnabled()) {
            log.info("Disconnected from Redis broker {} (worker={})", config.redactedUrl(), workerId);
        }
    }

    @Override
    public String workerId() {
        return workerId;
    }

    List<String> channelsFor(String taskKind) {
        String kindChannel = config.namespace() + ":" + taskKind;
        return List.of(kindChannel, kindChannel + ":" + workerId);
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
        return value;
    }

    interface RedisTransport {

        PubSubSession subscribe(List<String> channels, BiConsumer<String, String> listener);

        void shutdown();
    }

    interface PubSubSession extends AutoCloseable {

        boolean isOpen();

        @Override
        void close();
    }

    interface RedisTransportFactory {
        RedisTransport connect(BrokerConfig config);
    }

    private static final class LettuceRedisTransportFactory implements RedisTransportFactory {

        @Override
        public RedisTransport connect(BrokerConfig config) {
            RedisURI uri;
            try {
                uri = RedisURI.create(config.url());
            } catch (IllegalArgumentException ex) {
                throw new BrokerConfigurationException("Invalid Redis URL " + config.redactedUrl() + ": " + ex.getMessage());
            }
            uri.setTimeout(config.connectTimeout());
            RedisClient client = RedisClient.create(uri);
            // a dropped connection must end the streams instead of silently resubscribing
            client.setOptions(ClientOptions.builder().autoReconnect(false).build());
            try (StatefulRedisConnection<String, String> probe = client.connect()) {
                probe.sync().ping();
            } catch (RuntimeException ex) {
                client.shutdown();
                throw ex;
            }
            return new LettuceRedisTransport(client);
        }
    }

    private static final class LettuceRedisTransport implements RedisTransport {

        private final RedisClient client;

        private LettuceRedisTransport(RedisClient client) {
            this.client = client;
        }

        @Override
        public PubSubSession subscribe(List<String> channels, BiConsumer<String, String> listener) {
            StatefulRedisPubSubConnection<String, String> connection = client.connectPubSub();
            connection.addListener(new RedisPubSubAdapter<>() {
                @Override
                public void message(String channel, String message) {
                    listener.accept(channel, message);
                }
            });
            try {
                connection.sync().subscribe(channels.toArray(String[]::new));
            } catch (RuntimeException ex) {
                connection.close();
                throw ex;
            }
            return new PubSubSession() {
                @Override
                public boolean isOpen() {
                    return connection.isOpen();
                }

                @Override
                public void close() {
                    connection.close();
                }
            };
        }

        @Override
        public void shutdown() {
            client.shutdown();
        }
    }
}
