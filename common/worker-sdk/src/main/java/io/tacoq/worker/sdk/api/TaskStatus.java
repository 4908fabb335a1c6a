package io.tacoq.worker.sdk.api;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Task states tracked by the coordinator. The wire form is the lower-case constant name.
 */
public enum TaskStatus {
    /** Created but not yet assigned. */
    PENDING,
    /** Receipt acknowledged by a worker. */
    ACCEPTED,
    /** Assigned to a worker and sent to its queue. */
    QUEUED,
    RUNNING,
    PAUSED,
    RETRYING,
    COMPLETED,
    FAILED,
    CANCELLED,
    TIMEOUT,
    /** Refused by the worker. */
    REJECTED,
    /** Waiting on dependencies. */
    BLOCKED;

    private static final Set<TaskStatus> FINISHED = EnumSet.of(COMPLETED, FAILED, CANCELLED, TIMEOUT, REJECTED);

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isFinished() {
        return FINISHED.contains(this);
    }

    public static TaskStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("task status must not be null or blank");
        }
        String normalised = value.trim().toUpperCase(Locale.ROOT);
        for (TaskStatus status : values()) {
            if (status.name().equals(normalised)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status '" + value + "'");
    }
}
