package io.tacoq.examples.starter.echo;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.tacoq.worker.sdk.api.TaskOutcome;
import io.tacoq.worker.sdk.runtime.TaskExecutor;
import io.tacoq.worker.sdk.runtime.TaskMetrics;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EchoWorkerHandlersTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private final TaskExecutor executor = new TaskExecutor(
      Map.of("echo", new EchoTaskHandler(), "boom", new BoomTaskHandler()),
      new TaskMetrics(new SimpleMeterRegistry()));

  @Test
  void echoReturnsItsInput() throws Exception {
    JsonNode input = mapper.readTree("{\"text\":\"hi\"}");

    TaskOutcome outcome = executor.execute("echo", input, "t1");

    assertThat(outcome).isEqualTo(TaskOutcome.success(mapper.readTree("{\"text\":\"hi\"}")));
  }

  @Test
  void boomIsReportedAsFailure() throws Exception {
    TaskOutcome outcome = executor.execute("boom", mapper.readTree("{}"), "t2");

    assertThat(outcome).isEqualTo(TaskOutcome.failure("boom"));
  }
}
