package io.tacoq.worker.sdk.api;

/**
 * Identifier the coordinator assigned to a worker at registration. It addresses the worker on the
 * broker and is valid until the worker unregisters.
 */
public record WorkerIdentity(String id) {

    public WorkerIdentity {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        id = id.trim();
    }

    @Override
    public String toString() {
        return id;
    }
}
