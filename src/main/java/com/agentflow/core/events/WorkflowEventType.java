package com.agentflow.core.events;

/**
 * The events a workflow run publishes, with their dotted wire names.
 */
public enum WorkflowEventType {

    WORKFLOW_STARTED("workflow.started"),
    WORKFLOW_PAUSED("workflow.paused"),
    WORKFLOW_RESUMED("workflow.resumed"),
    WORKFLOW_STOPPED("workflow.stopped"),
    WORKFLOW_COMPLETED("workflow.completed"),
    WORKFLOW_FAILED("workflow.failed"),
    WAVE_STARTED("wave.started"),
    WAVE_COMPLETED("wave.completed"),
    TASK_STARTED("task.started"),
    TASK_RETRYING("task.retrying"),
    TASK_COMPLETED("task.completed"),
    TASK_FAILED("task.failed");

    private final String eventName;

    WorkflowEventType(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
