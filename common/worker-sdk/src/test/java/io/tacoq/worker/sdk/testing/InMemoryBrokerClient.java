package io.tacoq.worker.sdk.testing;

import com.fasterxml.jackson.databind.JsonNode;
import io.tacoq.broker.BrokerClient;
import io.tacoq.broker.BrokerClientFactory;
import io.tacoq.broker.BrokerConnectionException;
import io.tacoq.broker.ReceivedTask;
import io.tacoq.broker.TaskEnvelope;
import io.tacoq.broker.TaskStream;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Broker double keeping one in-memory queue per task kind. Also acts as its own factory.
 */
public final class InMemoryBrokerClient implements BrokerClient, BrokerClientFactory {

    private static final ReceivedTask TERMINATED = ReceivedTask.unacknowledged(
        new TaskEnvelope(null, "terminated", "terminated"));

    private final Timeline timeline;
    private final Map<String, BlockingQueue<ReceivedTask>> queues = new ConcurrentHashMap<>();
    private final List<String> acknowledged = new CopyOnWriteArrayList<>();
    private final List<String> consumedKinds = new CopyOnWriteArrayList<>();
    private final AtomicInteger connects = new AtomicInteger();
    private final AtomicInteger disconnects = new AtomicInteger();
    private volatile String workerId;
    private volatile RuntimeException connectFailure;

    public InMemoryBrokerClient() {
        this(new Timeline());
    }

    public InMemoryBrokerClient(Timeline timeline) {
        this.timeline = timeline;
    }

    @Override
    public BrokerClient create(String workerId) {
        this.workerId = workerId;
        return this;
    }

    @Override
    public void connect() {
        connects.incrementAndGet();
        if (connectFailure != null) {
            throw connectFailure;
        }
        timeline.record("connect");
    }

    @Override
    public void disconnect() {
        disconnects.incrementAndGet();
        timeline.record("disconnect");
    }

    @Override
    public TaskStream consume(String taskKind) {
        consumedKinds.add(taskKind);
        return new Stream(taskKind, queue(taskKind));
    }

    @Override
    public String workerId() {
        return workerId;
    }

    public void failConnect(RuntimeException failure) {
        this.connectFailure = failure;
    }

    public void publish(String kind, String taskId, JsonNode payload) {
        publish(kind, new TaskEnvelope(payload, taskId, kind));
    }

    public void publish(String streamKind, TaskEnvelope envelope) {
        queue(streamKind).add(new ReceivedTask(envelope, () -> acknowledged.add(envelope.taskId())));
    }

    /**
     * Makes the stream for {@code kind} fail on its next poll, as a dropped transport would.
     */
    public void terminate(String kind) {
        queue(kind).add(TERMINATED);
    }

    public List<String> acknowledged() {
        return acknowledged;
    }

    public List<String> consumedKinds() {
        return consumedKinds;
    }

    public int connects() {
        return connects.get();
    }

    public int disconnects() {
        return disconnects.get();
    }

    private BlockingQueue<ReceivedTask> queue(String kind) {
        return queues.computeIfAbsent(kind, ignored -> new LinkedBlockingQueue<>());
    }

    private static final class Stream implements TaskStream {

        private final String kind;
        private final BlockingQueue<ReceivedTask> queue;
        private volatile boolean open = true;

        private Stream(String kind, BlockingQueue<ReceivedTask> queue) {
            this.kind = kind;
            this.queue = queue;
        }

        @Override
        public Optional<ReceivedTask> poll(Duration timeout) throws InterruptedException {
            if (!open) {
                throw new BrokerConnectionException("stream for " + kind + " terminated");
            }
            ReceivedTask task = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (task == TERMINATED) {
                open = false;
                throw new BrokerConnectionException("stream for " + kind + " terminated");
            }
            return Optional.ofNullable(task);
        }

        @Override
        public String taskKind() {
            return kind;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
        }
    }
}
