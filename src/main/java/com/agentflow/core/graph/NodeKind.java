package com.agentflow.core.graph;

/**
 * Kind of node in the workflow graph shown to editors.
 */
public enum NodeKind {
    AGENT,
    TASK
}
