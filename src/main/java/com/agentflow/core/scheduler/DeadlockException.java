package com.agentflow.core.scheduler;

import com.agentflow.core.model.WorkflowExecution;

/**
 * Thrown when unresolved tasks remain but none can become ready: a dependency
 * failed, so its dependants can never run, or a cycle reached the scheduler
 * without passing validation. The execution it carries is already
 * {@code FAILED}, with the stuck tasks named in its error.
 */
public class DeadlockException extends RuntimeException {

    private final transient WorkflowExecution execution;

    public DeadlockException(String message, WorkflowExecution execution) {
        super(message);
        this.execution = execution;
    }

    public WorkflowExecution getExecution() {
        return execution;
    }
}
