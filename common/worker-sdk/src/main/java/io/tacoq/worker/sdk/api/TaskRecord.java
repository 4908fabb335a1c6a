package io.tacoq.worker.sdk.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Coordinator view of a task.
 *
 * @param assignedTo worker id the task was assigned to, {@code null} while unassigned
 * @param result     stored result, {@code null} until the task finished
 */
public record TaskRecord(
    String id,
    String taskKind,
    JsonNode inputData,
    TaskStatus status,
    Instant createdAt,
    String assignedTo,
    TaskResult result
) {

    public TaskRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(taskKind, "taskKind");
        Objects.requireNonNull(status, "status");
        inputData = inputData == null ? NullNode.getInstance() : inputData;
    }

    public Optional<TaskResult> resultIfPresent() {
        return Optional.ofNullable(result);
    }

    public boolean hasFinished() {
        return status.isFinished();
    }

    public boolean hasCompleted() {
        return status == TaskStatus.COMPLETED;
    }

    public boolean hasFailed() {
        return status == TaskStatus.FAILED;
    }
}
