package io.tacoq.broker.rabbit;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.ShutdownSignalException;
import io.tacoq.broker.BrokerConnectionException;
import io.tacoq.broker.ReceivedTask;
import io.tacoq.broker.TaskEnvelope;
import io.tacoq.broker.TaskStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stream over a single manual-ack consumer. The channel runs with a prefetch of one, so the broker
 * only pushes the next delivery after the previous one was acknowledged.
 */
final class RabbitTaskStream implements TaskStream {

    private static final Logger log = LoggerFactory.getLogger(RabbitTaskStream.class);
    private static final Delivery TERMINATED = new Delivery(null, null, new byte[0]);

    private final String taskKind;
    private final Channel channel;
    private final String queue;
    private final RabbitDeliveryDecoder decoder;
    private final BlockingQueue<Delivery> deliveries = new LinkedBlockingQueue<>();

    private volatile String consumerTag;
    private volatile BrokerConnectionException failure;
    private volatile boolean closed;

    RabbitTaskStream(String taskKind, Channel channel, String queue, RabbitDeliveryDecoder decoder) {
        this.taskKind = Objects.requireNonNull(taskKind, "taskKind");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    void start() throws IOException {
        consumerTag = channel.basicConsume(
            queue,
            false,
            (tag, delivery) -> deliveries.offer(delivery),
            tag -> terminate(new BrokerConnectionException("Consumer for queue " + queue + " was cancelled by the broker")),
            (tag, signal) -> onShutdown(signal));
    }

    @Override
    public Optional<ReceivedTask> poll(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        if (closed) {
            throw new BrokerConnectionException("Stream for task kind " + taskKind + " is closed");
        }
        Delivery delivery = deliveries.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (delivery == null) {
            BrokerConnectionException current = failure;
            if (current != null) {
                throw current;
            }
            return Optional.empty();
        }
        if (delivery == TERMINATED) {
            // keep the marker so later polls fail as well
            deliveries.offer(TERMINATED);
            throw failure;
        }
        long deliveryTag = delivery.getEnvelope().getDeliveryTag();
        TaskEnvelope envelope;
        try {
            envelope = decoder.decode(delivery.getBody(), delivery.getProperties(), deliveryTag, taskKind);
        } catch (IllegalArgumentException ex) {
            log.warn("Rejecting undecodable delivery {} on queue {}: {}", deliveryTag, queue, ex.getMessage());
            reject(deliveryTag);
            return Optional.empty();
        }
        return Optional.of(new ReceivedTask(envelope, () -> acknowledge(deliveryTag)));
    }

    @Override
    public String taskKind() {
        return taskKind;
    }

    @Override
    public boolean isOpen() {
        return !closed && failure == null && channel.isOpen();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        String tag = consumerTag;
        if (tag != null && channel.isOpen()) {
            try {
                channel.basicCancel(tag);
            } catch (IOException | ShutdownSignalException ex) {
                log.debug("Failed to cancel consumer {} on queue {}", tag, queue, ex);
            }
        }
        RabbitBrokerClient.closeQuietly(channel);
    }

    private void acknowledge(long deliveryTag) {
        try {
            channel.basicAck(deliveryTag, false);
        } catch (IOException | ShutdownSignalException ex) {
            throw new BrokerConnectionException("Failed to acknowledge delivery " + deliveryTag + " on queue " + queue, ex);
        }
    }

    private void reject(long deliveryTag) {
        try {
            channel.basicReject(deliveryTag, false);
        } catch (IOException | ShutdownSignalException ex) {
            throw new BrokerConnectionException("Failed to reject delivery " + deliveryTag + " on queue " + queue, ex);
        }
    }

    private void onShutdown(ShutdownSignalException signal) {
        if (closed) {
            return;
        }
        terminate(new BrokerConnectionException("AMQP channel for queue " + queue + " shut down", signal));
    }

    private void terminate(BrokerConnectionException cause) {
        if (failure == null) {
            failure = cause;
        }
        deliveries.offer(TERMINATED);
    }
}
