package io.tacoq.broker.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.tacoq.broker.TaskEnvelope;
import java.util.Objects;
import java.util.UUID;

/**
 * Decodes a published message. Task messages are {@code {"id": .., "task_kind": .., "input_data": ..}}
 * documents; any other JSON value is taken as the bare input and gets a generated task id.
 */
final class RedisMessageDecoder {

    private final ObjectMapper mapper;

    RedisMessageDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    TaskEnvelope decode(String message, String subscribedKind) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message is empty");
        }
        JsonNode node;
        try {
            node = mapper.readTree(message);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("message is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
        String id = text(node.get("id"));
        if (!node.isObject() || id == null) {
            return new TaskEnvelope(node, UUID.randomUUID().toString(), subscribedKind);
        }
        String kind = kindOf(node.get("task_kind"));
        JsonNode input = node.get("input_data");
        return new TaskEnvelope(input == null ? NullNode.getInstance() : input, id,
            kind != null ? kind : subscribedKind);
    }

    private static String kindOf(JsonNode node) {
        if (node != null && node.isObject()) {
            return text(node.get("name"));
        }
        return text(node);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText();
        return value == null || value.isBlank() ? null : value;
    }
}
