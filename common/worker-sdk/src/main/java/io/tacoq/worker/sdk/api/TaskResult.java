package io.tacoq.worker.sdk.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.time.Instant;

/**
 * Output or error data the coordinator stored for a finished task.
 */
public record TaskResult(JsonNode data, boolean isError, Instant createdAt) {

    public TaskResult {
        data = data == null ? NullNode.getInstance() : data;
    }
}
