package com.agentflow.core.graph;

/**
 * A node in the editable workflow graph.
 *
 * @param id   node identifier (agent or task id)
 * @param kind whether the node stands for an agent or a task
 */
public record GraphNode(String id, NodeKind kind) {

    public static GraphNode agent(String id) {
        return new GraphNode(id, NodeKind.AGENT);
    }

    public static GraphNode task(String id) {
        return new GraphNode(id, NodeKind.TASK);
    }
}
