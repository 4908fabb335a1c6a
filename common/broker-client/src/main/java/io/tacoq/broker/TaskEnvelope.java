package io.tacoq.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * One unit of work pulled from a broker stream.
 *
 * @param payload  task input document; {@link NullNode} when the task carries no input
 * @param taskId   identifier correlating with the coordinator's task record
 * @param taskKind kind used to select the handler
 */
public record TaskEnvelope(JsonNode payload, String taskId, String taskKind) {

    public TaskEnvelope {
        payload = payload == null ? NullNode.getInstance() : payload;
        taskId = requireText(taskId, "taskId");
        taskKind = requireText(taskKind, "taskKind");
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
        return value;
    }
}
