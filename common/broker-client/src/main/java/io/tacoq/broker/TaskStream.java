package io.tacoq.broker;

import java.time.Duration;
import java.util.Optional;

/**
 * Pull-based sequence of tasks for a single task kind.
 *
 * <p>The stream hands out at most one unacknowledged task at a time: the next delivery is only
 * pulled from the transport once the previous {@link ReceivedTask} was acknowledged. A stream that
 * lost its transport stays terminated; callers open a new one through
 * {@link BrokerClient#consume(String)}.</p>
 */
public interface TaskStream extends AutoCloseable {

    /**
     * Waits up to {@code timeout} for the next task.
     *
     * @return the next task, or empty when none arrived in time
     * @throws BrokerConnectionException when the stream has terminated (transport dropped or the
     *                                   consumer was cancelled by the broker)
     * @throws InterruptedException      when the calling thread is interrupted while waiting
     */
    Optional<ReceivedTask> poll(Duration timeout) throws InterruptedException;

    /**
     * Task kind this stream was opened for.
     */
    String taskKind();

    /**
     * Returns {@code true} while the stream can still produce tasks.
     */
    boolean isOpen();

    /**
     * Cancels the underlying consumer. Unacknowledged deliveries return to the broker when the
     * transport supports redelivery.
     */
    @Override
    void close();
}
