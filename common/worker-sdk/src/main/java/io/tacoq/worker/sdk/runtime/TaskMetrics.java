package io.tacoq.worker.sdk.runtime;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.tacoq.worker.sdk.api.TaskOutcome;
import java.util.Objects;

/**
 * Micrometer instrumentation for task execution and result reporting.
 */
public final class TaskMetrics {

    public static final String TASK_DURATION = "tacoq.worker.task.duration";
    public static final String REPORT_FAILURES = "tacoq.worker.report.failures";

    private final MeterRegistry meterRegistry;

    public TaskMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    Timer.Sample start() {
        return Timer.start(meterRegistry);
    }

    void recordExecution(Timer.Sample sample, String taskKind, TaskOutcome outcome) {
        sample.stop(Timer.builder(TASK_DURATION)
            .description("Handler execution time per task kind")
            .tag("kind", taskKind)
            .tag("outcome", outcome.isError() ? "failure" : "success")
            .register(meterRegistry));
    }

    void recordReportFailure(String taskKind) {
        Counter.builder(REPORT_FAILURES)
            .description("Task results that could not be delivered to the coordinator")
            .tag("kind", taskKind)
            .register(meterRegistry)
            .increment();
    }
}
