package io.tacoq.worker.sdk.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.api.Test;

class TaskStatusTest {

    @ParameterizedTest
    @EnumSource(TaskStatus.class)
    void wireValueRoundTripsThroughParsing(TaskStatus status) {
        assertThat(TaskStatus.fromWire(status.wireValue())).isEqualTo(status);
    }

    @Test
    void parsingIsCaseInsensitive() {
        assertThat(TaskStatus.fromWire("Running")).isEqualTo(TaskStatus.RUNNING);
        assertThat(TaskStatus.RUNNING.wireValue()).isEqualTo("running");
    }

    @Test
    void finishedStatesAreTerminal() {
        assertThat(TaskStatus.values())
            .filteredOn(TaskStatus::isFinished)
            .containsExactlyInAnyOrder(TaskStatus.COMPLETED, TaskStatus.FAILED, TaskStatus.CANCELLED,
                TaskStatus.TIMEOUT, TaskStatus.REJECTED);
    }

    @Test
    void unknownStatusIsRejected() {
        assertThatThrownBy(() -> TaskStatus.fromWire("exploded")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TaskStatus.fromWire(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
