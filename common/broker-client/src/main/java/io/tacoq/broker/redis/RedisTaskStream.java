package io.tacoq.broker.redis;

import io.tacoq.broker.BrokerConnectionException;
import io.tacoq.broker.ReceivedTask;
import io.tacoq.broker.TaskEnvelope;
import io.tacoq.broker.TaskStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stream fed by a pub/sub listener. Messages are pushed by Redis regardless of consumer progress, so
 * they are held in a bounded buffer and dropped when it is full.
 */
final class RedisTaskStream implements TaskStream {

    private static final Logger log = LoggerFactory.getLogger(RedisTaskStream.class);

    private final String taskKind;
    private final RedisMessageDecoder decoder;
    private final BlockingQueue<Published> buffer;

    private volatile RedisBrokerClient.PubSubSession session;
    private volatile boolean closed;

    RedisTaskStream(String taskKind, RedisMessageDecoder decoder, int capacity) {
        this.taskKind = Objects.requireNonNull(taskKind, "taskKind");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.buffer = new LinkedBlockingQueue<>(capacity);
    }

    void attach(RedisBrokerClient.PubSubSession session) {
        this.session = Objects.requireNonNull(session, "session");
    }

    void onMessage(String channel, String message) {
        if (closed) {
            return;
        }
        if (!buffer.offer(new Published(channel, message))) {
            log.warn("Dropping message on channel {}: buffer for task kind {} is full", channel, taskKind);
        }
    }

    @Override
    public Optional<ReceivedTask> poll(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        if (closed) {
            throw new BrokerConnectionException("Stream for task kind " + taskKind + " is closed");
        }
        Published published = buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (published == null) {
            RedisBrokerClient.PubSubSession current = session;
            if (current != null && !current.isOpen()) {
                throw new BrokerConnectionException("Redis subscription for task kind " + taskKind + " was closed");
            }
            return Optional.empty();
        }
        TaskEnvelope envelope;
        try {
            envelope = decoder.decode(published.message(), taskKind);
        } catch (IllegalArgumentException ex) {
            log.warn("Discarding undecodable message on channel {}: {}", published.channel(), ex.getMessage());
            return Optional.empty();
        }
        return Optional.of(ReceivedTask.unacknowledged(envelope));
    }

    @Override
    public String taskKind() {
        return taskKind;
    }

    @Override
    public boolean isOpen() {
        RedisBrokerClient.PubSubSession current = session;
        return !closed && current != null && current.isOpen();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        RedisBrokerClient.PubSubSession current = session;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException ex) {
                log.debug("Failed to close Redis subscription for task kind {}", taskKind, ex);
            }
        }
        int dropped = buffer.size();
        buffer.clear();
        if (dropped > 0) {
            log.warn("Discarded {} buffered message(s) for task kind {} on close", dropped, taskKind);
        }
    }

    private record Published(String channel, String message) {
    }
}
