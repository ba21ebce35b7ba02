package com.agentflow.core.model;

/**
 * Strategy for invoking the tasks of a wave.
 * <p>
 * SEQUENTIAL: one capability invocation in flight at a time.
 * PARALLEL: up to maxParallel invocations in flight.
 * Wave boundaries are the same for both; only in-wave concurrency differs.
 */
public enum ExecutionStrategy {
    SEQUENTIAL,
    PARALLEL
}
