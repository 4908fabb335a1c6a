package io.tacoq.worker.sdk.runtime;

import io.tacoq.broker.BrokerConnectionException;
import io.tacoq.broker.ReceivedTask;
import io.tacoq.broker.TaskEnvelope;
import io.tacoq.broker.TaskStream;
import io.tacoq.worker.sdk.api.TaskOutcome;
import io.tacoq.worker.sdk.api.TaskStatus;
import io.tacoq.worker.sdk.coordinator.CoordinatorClient;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Poll, execute, report, acknowledge for a single task kind.
 * <p>
 * The loop checks the shared shutdown signal between polls and never abandons a task it already
 * pulled: once a task was received its outcome is reported and the delivery acknowledged before the
 * loop looks at the signal again. A terminated stream ends this loop only.
 */
final class TaskConsumptionLoop implements Runnable {

    static final String MDC_TASK_ID = "task_id";
    static final String MDC_TASK_KIND = "task_kind";
    static final String MDC_WORKER_ID = "worker_id";

    private static final Logger log = LoggerFactory.getLogger(TaskConsumptionLoop.class);

    private final String workerId;
    private final TaskStream stream;
    private final TaskExecutor executor;
    private final CoordinatorClient coordinator;
    private final TaskMetrics metrics;
    private final CountDownLatch shutdownSignal;
    private final Duration pollInterval;
    private final boolean reportRunningStatus;

    TaskConsumptionLoop(String workerId,
                        TaskStream stream,
                        TaskExecutor executor,
                        CoordinatorClient coordinator,
                        TaskMetrics metrics,
                        CountDownLatch shutdownSignal,
                        Duration pollInterval,
                        boolean reportRunningStatus) {
        this.workerId = Objects.requireNonNull(workerId, "workerId");
        this.stream = Objects.requireNonNull(stream, "stream");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.shutdownSignal = Objects.requireNonNull(shutdownSignal, "shutdownSignal");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.reportRunningStatus = reportRunningStatus;
    }

    @Override
    public void run() {
        String kind = stream.taskKind();
        MDC.put(MDC_WORKER_ID, workerId);
        log.info("Consumption loop for task kind {} started", kind);
        try {
            while (shutdownSignal.getCount() > 0) {
                Optional<ReceivedTask> next;
                try {
                    next = stream.poll(pollInterval);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    log.info("Consumption loop for task kind {} interrupted", kind);
                    return;
                } catch (BrokerConnectionException ex) {
                    log.error("Task stream for kind {} terminated; loop stops", kind, ex);
                    return;
                }
                next.ifPresent(this::process);
            }
            log.info("Consumption loop for task kind {} drained", kind);
        } finally {
            MDC.remove(MDC_WORKER_ID);
        }
    }

    /**
     * Handles one received task. An interrupt raised by handler code is cleared here; only the shutdown
     * signal stops the loop.
     */
    private void process(ReceivedTask task) {
        TaskEnvelope envelope = task.envelope();
        MDC.put(MDC_TASK_ID, envelope.taskId());
        MDC.put(MDC_TASK_KIND, envelope.taskKind());
        try {
            if (reportRunningStatus) {
                reportStatus(envelope, TaskStatus.RUNNING);
            }
            TaskOutcome outcome = execute(envelope);
            if (Thread.interrupted()) {
                log.warn("Handler for task {} left its thread interrupted; flag cleared", envelope.taskId());
            }
            reportResult(envelope, outcome);
            acknowledge(task);
        } finally {
            MDC.remove(MDC_TASK_ID);
            MDC.remove(MDC_TASK_KIND);
        }
    }

    private TaskOutcome execute(TaskEnvelope envelope) {
        try {
            return executor.execute(envelope.taskKind(), envelope.payload(), envelope.taskId());
        } catch (WorkerStateException ex) {
            log.error("Task {} cannot be executed: {}", envelope.taskId(), ex.getMessage());
            return TaskOutcome.failure(ex.getMessage());
        }
    }

    private void reportStatus(TaskEnvelope envelope, TaskStatus status) {
        try {
            coordinator.reportStatus(envelope.taskId(), status);
        } catch (RuntimeException ex) {
            log.warn("Failed to report status {} for task {}: {}", status.wireValue(), envelope.taskId(), ex.getMessage());
        }
    }

    private void reportResult(TaskEnvelope envelope, TaskOutcome outcome) {
        try {
            coordinator.reportResult(envelope.taskId(), outcome);
            log.debug("Reported {} for task {}", outcome.isError() ? "failure" : "success", envelope.taskId());
        } catch (RuntimeException ex) {
            metrics.recordReportFailure(envelope.taskKind());
            log.error("Failed to report result for task {}", envelope.taskId(), ex);
        }
    }

    private void acknowledge(ReceivedTask task) {
        try {
            task.acknowledge();
        } catch (BrokerConnectionException ex) {
            log.warn("Failed to acknowledge task {}: {}", task.envelope().taskId(), ex.getMessage());
        }
    }
}
