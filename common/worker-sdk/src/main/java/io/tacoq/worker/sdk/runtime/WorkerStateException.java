package io.tacoq.worker.sdk.runtime;

/**
 * Raised when an engine operation is not allowed in the current {@link WorkerLifecycleState}, or when
 * a task arrives for a kind without a handler.
 */
public class WorkerStateException extends IllegalStateException {

    public WorkerStateException(String message) {
        super(message);
    }
}
