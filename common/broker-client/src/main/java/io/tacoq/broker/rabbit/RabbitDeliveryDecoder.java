package io.tacoq.broker.rabbit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.rabbitmq.client.AMQP;
import io.tacoq.broker.TaskEnvelope;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Turns an AMQP delivery into a {@link TaskEnvelope}.
 *
 * <p>The body is the task input as JSON. The task id comes from the {@value #TASK_ID_HEADER} header,
 * then the AMQP message id, then the delivery tag. The kind comes from the
 * {@value #TASK_KIND_HEADER} header, falling back to the kind the queue was consumed for.</p>
 */
final class RabbitDeliveryDecoder {

    static final String TASK_ID_HEADER = "task_id";
    static final String TASK_KIND_HEADER = "task_kind";

    private final ObjectMapper mapper;

    RabbitDeliveryDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    TaskEnvelope decode(byte[] body, AMQP.BasicProperties properties, long deliveryTag, String consumedKind) {
        JsonNode payload = parse(body);
        Map<String, Object> headers = properties == null ? null : properties.getHeaders();
        String taskId = headerText(headers, TASK_ID_HEADER);
        if (taskId == null && properties != null) {
            taskId = blankToNull(properties.getMessageId());
        }
        if (taskId == null) {
            taskId = Long.toString(deliveryTag);
        }
        String taskKind = headerText(headers, TASK_KIND_HEADER);
        return new TaskEnvelope(payload, taskId, taskKind != null ? taskKind : consumedKind);
    }

    private JsonNode parse(byte[] body) {
        if (body == null || body.length == 0) {
            return NullNode.getInstance();
        }
        try {
            JsonNode node = mapper.readTree(body);
            return node == null || node.isMissingNode() ? NullNode.getInstance() : node;
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("message body is not valid JSON: " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new IllegalArgumentException("message body could not be read", ex);
        }
    }

    private static String headerText(Map<String, Object> headers, String name) {
        if (headers == null) {
            return null;
        }
        Object value = headers.get(name);
        if (value == null) {
            return null;
        }
        // LongString and byte[] are how AMQP tables carry strings
        if (value instanceof byte[] bytes) {
            return blankToNull(new String(bytes, StandardCharsets.UTF_8));
        }
        return blankToNull(value.toString());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
