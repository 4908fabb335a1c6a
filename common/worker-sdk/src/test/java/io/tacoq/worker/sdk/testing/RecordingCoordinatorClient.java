package io.tacoq.worker.sdk.testing;

import io.tacoq.worker.sdk.api.CoordinatorHealth;
import io.tacoq.worker.sdk.api.TaskOutcome;
import io.tacoq.worker.sdk.api.TaskRecord;
import io.tacoq.worker.sdk.api.TaskStatus;
import io.tacoq.worker.sdk.api.WorkerIdentity;
import io.tacoq.worker.sdk.coordinator.CoordinatorClient;
import io.tacoq.worker.sdk.coordinator.CoordinatorException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Coordinator double that records every call.
 */
public final class RecordingCoordinatorClient implements CoordinatorClient {

    public static final String WORKER_ID = "worker-1";

    private final Timeline timeline;
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final List<Report> results = new CopyOnWriteArrayList<>();
    private final List<StatusUpdate> statuses = new CopyOnWriteArrayList<>();
    private final List<WorkerIdentity> unregistrations = new CopyOnWriteArrayList<>();
    private final Set<String> rejectedResults = ConcurrentHashMap.newKeySet();
    private volatile RuntimeException registrationFailure;

    public RecordingCoordinatorClient() {
        this(new Timeline());
    }

    public RecordingCoordinatorClient(Timeline timeline) {
        this.timeline = timeline;
    }

    @Override
    public WorkerIdentity registerWorker(String name, List<String> taskKinds) {
        if (registrationFailure != null) {
            throw registrationFailure;
        }
        registrations.add(new Registration(name, List.copyOf(taskKinds)));
        timeline.record("register");
        return new WorkerIdentity(WORKER_ID);
    }

    @Override
    public void unregisterWorker(WorkerIdentity worker) {
        unregistrations.add(worker);
        timeline.record("unregister");
    }

    @Override
    public void reportStatus(String taskId, TaskStatus status) {
        statuses.add(new StatusUpdate(taskId, status));
        timeline.record("status:" + taskId + ":" + status.wireValue());
    }

    @Override
    public void reportResult(String taskId, TaskOutcome outcome) {
        if (rejectedResults.contains(taskId)) {
            throw new CoordinatorException("result of task " + taskId + " returned status 500", 500);
        }
        results.add(new Report(taskId, outcome));
        timeline.record("result:" + taskId);
    }

    @Override
    public TaskRecord getTask(String taskId) {
        throw new UnsupportedOperationException("getTask");
    }

    @Override
    public CoordinatorHealth checkHealth() {
        return CoordinatorHealth.HEALTHY;
    }

    public void failRegistration(RuntimeException failure) {
        this.registrationFailure = failure;
    }

    public void rejectResultFor(String taskId) {
        rejectedResults.add(taskId);
    }

    public List<Registration> registrations() {
        return registrations;
    }

    public List<Report> results() {
        return results;
    }

    public List<Report> resultsFor(String taskId) {
        return results.stream().filter(report -> report.taskId().equals(taskId)).toList();
    }

    public List<StatusUpdate> statuses() {
        return statuses;
    }

    public List<WorkerIdentity> unregistrations() {
        return unregistrations;
    }

    public record Registration(String name, List<String> taskKinds) {
    }

    public record Report(String taskId, TaskOutcome outcome) {
    }

    public record StatusUpdate(String taskId, TaskStatus status) {
    }
}
