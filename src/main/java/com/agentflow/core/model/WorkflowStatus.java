package com.agentflow.core.model;

/**
 * Lifecycle status of a workflow definition.
 */
public enum WorkflowStatus {
    DRAFT,
    ACTIVE,
    PAUSED,
    COMPLETED,
    FAILED
}
