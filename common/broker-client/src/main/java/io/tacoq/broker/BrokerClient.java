package io.tacoq.broker;

/**
 * Transport session used by the worker engine to pull work from a message broker.
 *
 * <p>A client owns no policy: it only knows how to open a session, how to route a task kind to this
 * worker and how to turn broker deliveries into {@link TaskEnvelope}s. Instances are created per
 * worker identity by a {@link BrokerClientFactory}.</p>
 *
 * <p>Typical use:</p>
 * <pre>
 * BrokerClient client = BrokerClients.factoryFor(config).create(workerId);
 * client.connect();
 * try (TaskStream stream = client.consume("echo")) {
 *     Optional&lt;ReceivedTask&gt; next = stream.poll(Duration.ofMillis(500));
 *     ...
 * } finally {
 *     client.disconnect();
 * }
 * </pre>
 */
public interface BrokerClient {

    /**
     * Opens the transport session. Calling it again after a successful connect is a no-op.
     *
     * @throws BrokerConnectionException when the broker is unreachable or rejects the credentials
     */
    void connect();

    /**
     * Releases every channel, subscription and connection owned by this client. Only the first call
     * after a successful {@link #connect()} has an effect.
     */
    void disconnect();

    /**
     * Opens a new consumption stream for the given task kind. Each call sets up its own routing and
     * its own consumer, so several kinds can be consumed concurrently over one session.
     *
     * @param taskKind task kind to route to this worker
     * @return a fresh, unbounded stream of tasks
     * @throws BrokerConnectionException when the routing cannot be established
     * @throws IllegalStateException when the client is not connected
     */
    TaskStream consume(String taskKind);

    /**
     * Identity this client routes work to.
     */
    String workerId();
}
