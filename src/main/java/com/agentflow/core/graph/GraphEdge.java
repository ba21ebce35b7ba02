package com.agentflow.core.graph;

/**
 * A directed edge in the workflow graph.
 * <p>
 * Agent to task: the agent is assigned to the task.
 * Task to task: the target depends on the source.
 *
 * @param id     edge identifier
 * @param source source node id
 * @param target target node id
 */
public record GraphEdge(String id, String source, String target) {

    public static GraphEdge of(String source, String target) {
        return new GraphEdge(source + "->" + target, source, target);
    }
}
