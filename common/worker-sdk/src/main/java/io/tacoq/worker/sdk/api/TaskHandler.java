package io.tacoq.worker.sdk.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Application code executed for every task of one task kind.
 * <p>
 * Handlers receive the task input as a JSON document ({@link com.fasterxml.jackson.databind.node.NullNode}
 * when the task carries no input) and return the output document. Anything thrown is turned into a
 * {@link TaskOutcome.Failure} by the runtime and reported to the coordinator; it never reaches the broker.
 * Handlers of one kind run sequentially, handlers of different kinds run concurrently.
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * Processes one task.
     *
     * @param input task input, never {@code null}
     * @return task output; {@code null} is reported as a JSON {@code null}
     * @throws Exception to report the task as failed
     */
    JsonNode handle(JsonNode input) throws Exception;
}
