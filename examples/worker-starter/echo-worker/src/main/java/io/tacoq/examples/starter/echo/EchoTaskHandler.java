package io.tacoq.examples.starter.echo;

import com.fasterxml.jackson.databind.JsonNode;
import io.tacoq.worker.sdk.api.TaskHandler;
import io.tacoq.worker.sdk.autoconfigure.TacoqTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Returns the task input unchanged.
 */
@Component
@TacoqTask("echo")
class EchoTaskHandler implements TaskHandler {

  private static final Logger log = LoggerFactory.getLogger(EchoTaskHandler.class);

  @Override
  public JsonNode handle(JsonNode input) {
    log.debug("Echoing {}", input);
    return input;
  }
}
