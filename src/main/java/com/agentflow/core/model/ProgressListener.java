package com.agentflow.core.model;

/**
 * Receives the live execution at every state change: run start, each recorded
 * task result, each wave completion, pause, resume and the terminal state.
 * <p>
 * Task results are reported from the wave's branch threads, so calls for
 * tasks of the same wave may overlap. Implementations must be thread-safe and
 * must not block; exceptions they throw are logged and ignored.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = execution -> { };

    void onProgress(WorkflowExecution execution);
}
