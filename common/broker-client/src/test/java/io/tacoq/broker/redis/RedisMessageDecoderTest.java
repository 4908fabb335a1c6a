package io.tacoq.broker.redis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.tacoq.broker.TaskEnvelope;
import org.junit.jupiter.api.Test;

class RedisMessageDecoderTest {

    private final RedisMessageDecoder decoder = new RedisMessageDecoder(new ObjectMapper());

    @Test
    void readsTaskDocument() {
        TaskEnvelope envelope = decoder.decode(
            "{\"id\":\"t1\",\"task_kind\":\"resize\",\"input_data\":[1,2]}", "echo");

        assertThat(envelope.taskId()).isEqualTo("t1");
        assertThat(envelope.taskKind()).isEqualTo("resize");
        assertThat(envelope.payload().size()).isEqualTo(2);
    }

    @Test
    void missingKindAndInputFallBack() {
        TaskEnvelope envelope = decoder.decode("{\"id\":\"t1\"}", "echo");

        assertThat(envelope.taskKind()).isEqualTo("echo");
        assertThat(envelope.payload()).isEqualTo(NullNode.getInstance());
    }

    @Test
    void bareValuesGetGeneratedIds() {
        TaskEnvelope first = decoder.decode("{\"text\":\"hi\"}", "echo");
        TaskEnvelope second = decoder.decode("42", "echo");

        assertThat(first.payload().get("text").asText()).isEqualTo("hi");
        assertThat(second.payload().asInt()).isEqualTo(42);
        assertThat(first.taskId()).isNotBlank().isNotEqualTo(second.taskId());
    }

    @Test
    void rejectsEmptyAndMalformedMessages() {
        assertThatThrownBy(() -> decoder.decode(" ", "echo")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> decoder.decode("{", "echo"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not valid JSON");
    }
}
