package com.agentflow.core.graph;

import java.util.List;

/**
 * Thrown before a run starts when the workflow's task graph is not executable.
 * Carries every violation found, not only the first.
 */
public class WorkflowValidationException extends RuntimeException {

    private final String workflowId;
    private final List<String> violations;

    public WorkflowValidationException(String workflowId, List<String> violations) {
        super("Workflow " + workflowId + " is invalid: " + String.join("; ", violations));
        this.workflowId = workflowId;
        this.violations = List.copyOf(violations);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public List<String> getViolations() {
        return violations;
    }
}
