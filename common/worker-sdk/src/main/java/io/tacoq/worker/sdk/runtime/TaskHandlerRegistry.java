package io.tacoq.worker.sdk.runtime;

import io.tacoq.worker.sdk.api.TaskHandler;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Handlers keyed by task kind, in registration order. Mutable until {@link #freeze()}, read-only
 * afterwards so consumption loops can share it without locking.
 */
final class TaskHandlerRegistry {

    private final Map<String, TaskHandler> handlers = new LinkedHashMap<>();
    private Map<String, TaskHandler> frozen;

    synchronized void register(String taskKind, TaskHandler handler) {
        Objects.requireNonNull(handler, "handler");
        if (taskKind == null || taskKind.isBlank()) {
            throw new IllegalArgumentException("taskKind must not be null or blank");
        }
        if (frozen != null) {
            throw new WorkerStateException("Handler registry is frozen; cannot register task kind '" + taskKind + "'");
        }
        if (handlers.containsKey(taskKind)) {
            throw new IllegalArgumentException("A handler for task kind '" + taskKind + "' is already registered");
        }
        handlers.put(taskKind, handler);
    }

    synchronized Map<String, TaskHandler> freeze() {
        if (frozen == null) {
            frozen = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
        }
        return frozen;
    }

    synchronized boolean isEmpty() {
        return handlers.isEmpty();
    }

    synchronized List<String> kinds() {
        return List.copyOf(handlers.keySet());
    }
}
