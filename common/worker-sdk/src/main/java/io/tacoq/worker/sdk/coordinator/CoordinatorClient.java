package io.tacoq.worker.sdk.coordinator;

import io.tacoq.worker.sdk.api.CoordinatorHealth;
import io.tacoq.worker.sdk.api.TaskOutcome;
import io.tacoq.worker.sdk.api.TaskRecord;
import io.tacoq.worker.sdk.api.TaskStatus;
import io.tacoq.worker.sdk.api.WorkerIdentity;
import java.util.List;

/**
 * Worker-facing operations of the coordinator service.
 * <p>
 * Implementations are shared by every consumption loop of an engine and must be thread-safe. Calls
 * block until the coordinator answered.
 *
 * @see HttpCoordinatorClient
 */
public interface CoordinatorClient {

    /**
     * Announces a worker and the task kinds it handles.
     *
     * @throws CoordinatorConnectionException when the coordinator cannot be reached
     * @throws CoordinatorException           when the coordinator rejects the registration
     */
    WorkerIdentity registerWorker(String name, List<String> taskKinds);

    void unregisterWorker(WorkerIdentity worker);

    void reportStatus(String taskId, TaskStatus status);

    /**
     * Stores the outcome of a task. Successful outcomes are sent with their output,
     * failures with their description and {@code is_error = true}.
     */
    void reportResult(String taskId, TaskOutcome outcome);

    TaskRecord getTask(String taskId);

    /**
     * Probes the coordinator. Never throws for an unreachable coordinator.
     */
    CoordinatorHealth checkHealth();
}
