package io.tacoq.broker;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A delivered {@link TaskEnvelope} together with the handle that settles it with the broker.
 *
 * <p>Acknowledgement happens once, after the caller finished processing the task. Repeated calls are
 * ignored so cleanup paths can acknowledge unconditionally.</p>
 */
public final class ReceivedTask {

    private final TaskEnvelope envelope;
    private final Acknowledger acknowledger;
    private final AtomicBoolean acknowledged = new AtomicBoolean(false);

    public ReceivedTask(TaskEnvelope envelope, Acknowledger acknowledger) {
        this.envelope = Objects.requireNonNull(envelope, "envelope");
        this.acknowledger = Objects.requireNonNull(acknowledger, "acknowledger");
    }

    /**
     * Creates a task for transports without acknowledgement semantics.
     */
    public static ReceivedTask unacknowledged(TaskEnvelope envelope) {
        return new ReceivedTask(envelope, () -> { });
    }

    public TaskEnvelope envelope() {
        return envelope;
    }

    /**
     * Settles the delivery with the broker.
     *
     * @throws BrokerConnectionException when the acknowledgement could not be sent
     */
    public void acknowledge() {
        if (!acknowledged.compareAndSet(false, true)) {
            return;
        }
        acknowledger.acknowledge();
    }

    public boolean isAcknowledged() {
        return acknowledged.get();
    }

    @FunctionalInterface
    public interface Acknowledger {
        void acknowledge();
    }
}
