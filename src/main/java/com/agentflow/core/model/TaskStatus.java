package com.agentflow.core.model;

/**
 * Status of an individual task. Progresses one way (PENDING, RUNNING, then a
 * terminal value) except when a task is explicitly retried.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED
}
