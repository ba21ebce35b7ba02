package com.agentflow.core.model;

/**
 * Closed set of roles an agent can play inside a workflow.
 */
public enum AgentRole {
    RESEARCHER,
    ANALYST,
    EXECUTOR,
    REVIEWER,
    CUSTOM
}
