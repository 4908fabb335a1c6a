package io.tacoq.worker.sdk.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Objects;

/**
 * Normalised result of running a {@link TaskHandler}: either the handler output or a description of
 * what went wrong.
 */
public sealed interface TaskOutcome permits TaskOutcome.Success, TaskOutcome.Failure {

    static TaskOutcome success(JsonNode output) {
        return new Success(output);
    }

    static TaskOutcome failure(String description) {
        return new Failure(description);
    }

    /**
     * Whether the outcome is reported with {@code is_error = true}.
     */
    boolean isError();

    record Success(JsonNode output) implements TaskOutcome {

        public Success {
            output = output == null ? NullNode.getInstance() : output;
        }

        @Override
        public boolean isError() {
            return false;
        }
    }

    record Failure(String description) implements TaskOutcome {

        public Failure {
            Objects.requireNonNull(description, "description");
        }

        @Override
        public boolean isError() {
            return true;
        }
    }
}
