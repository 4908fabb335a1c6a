package io.tacoq.worker.sdk.runtime;

/**
 * Lifecycle of a {@link WorkerEngine}. States only move forward.
 */
public enum WorkerLifecycleState {
    /** Accepting handler registrations; nothing announced to the coordinator yet. */
    UNREGISTERED,
    /** Registering with the coordinator and connecting to the broker. */
    REGISTERING,
    /** Consumption loops are running. */
    ACTIVE,
    /** Loops stop pulling new tasks; in-flight handlers finish. */
    DRAINING,
    /** Broker disconnected and worker unregistered. Terminal. */
    TERMINATED
}
