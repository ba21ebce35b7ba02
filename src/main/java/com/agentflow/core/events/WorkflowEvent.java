package com.agentflow.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during workflow execution.
 *
 * @param type       what happened
 * @param workflowId the workflow this event belongs to
 * @param taskId     the task this event relates to (null for workflow- and wave-level events)
 * @param payload    event data, e.g. the wave number or the task's error
 * @param timestamp  when the event occurred
 */
public record WorkflowEvent(
    WorkflowEventType type,
    String workflowId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public WorkflowEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public static WorkflowEvent of(WorkflowEventType type, String workflowId, String taskId,
                                   Map<String, Object> payload) {
        return new WorkflowEvent(type, workflowId, taskId, payload, Instant.now());
    }

    public static WorkflowEvent ofWorkflow(WorkflowEventType type, String workflowId, Map<String, Object> payload) {
        return of(type, workflowId, null, payload);
    }

    /** Dotted wire name, e.g. {@code task.failed}. */
    public String eventType() {
        return type.eventName();
    }
}
