package io.tacoq.worker.sdk.api;

/**
 * Result of probing the coordinator's health endpoint.
 */
public enum CoordinatorHealth {
    HEALTHY,
    /** Reachable but answered with a non-success status. */
    UNHEALTHY,
    /** No HTTP response at all. */
    NOT_REACHABLE
}
