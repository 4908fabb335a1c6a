package io.tacoq.examples.starter.echo;

import com.fasterxml.jackson.databind.JsonNode;
import io.tacoq.worker.sdk.api.TaskHandler;
import io.tacoq.worker.sdk.autoconfigure.TacoqTask;
import org.springframework.stereotype.Component;

/**
 * Always fails, so publishers can see how handler errors come back as task results.
 */
@Component
@TacoqTask("boom")
class BoomTaskHandler implements TaskHandler {

  @Override
  public JsonNode handle(JsonNode input) {
    throw new IllegalStateException("boom");
  }
}
