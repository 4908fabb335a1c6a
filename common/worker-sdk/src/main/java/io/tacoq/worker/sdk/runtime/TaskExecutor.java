package io.tacoq.worker.sdk.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.micrometer.core.instrument.Timer;
import io.tacoq.worker.sdk.api.TaskHandler;
import io.tacoq.worker.sdk.api.TaskOutcome;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the handler registered for a task kind and converts whatever it does into a {@link TaskOutcome}.
 * This is the only place handler failures are caught.
 */
public final class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final Map<String, TaskHandler> handlers;
    private final TaskMetrics metrics;

    public TaskExecutor(Map<String, TaskHandler> handlers, TaskMetrics metrics) {
        this.handlers = Map.copyOf(Objects.requireNonNull(handlers, "handlers"));
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Executes one task.
     *
     * @throws WorkerStateException when no handler is registered for {@code taskKind}
     */
    public TaskOutcome execute(String taskKind, JsonNode payload, String taskId) {
        TaskHandler handler = handlers.get(taskKind);
        if (handler == null) {
            throw new WorkerStateException("No handler registered for task kind '" + taskKind + "'");
        }
        Timer.Sample sample = metrics.start();
        TaskOutcome outcome;
        try {
            outcome = TaskOutcome.success(handler.handle(payload == null ? NullNode.getInstance() : payload));
        } catch (Throwable ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("Task {} of kind {} failed: {}", taskId, taskKind, describe(ex), ex);
            outcome = TaskOutcome.failure(describe(ex));
        }
        metrics.recordExecution(sample, taskKind, outcome);
        return outcome;
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getName() : message;
    }
}
