package com.agentflow.core.graph;

import com.agentflow.core.model.Agent;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps the workflow's task graph acyclic and well-formed.
 * <p>
 * Editors call {@link #validateEdge} before committing a new edge and
 * {@link #reconcile} after deleting nodes; the scheduler calls
 * {@link #validateWorkflow} before every run. All methods are pure: they
 * never modify the collections they are given.
 * <p>
 * Cycle checks walk the graph depth-first, O(V+E) per call. Workflows are
 * expected to hold tens of tasks, so no incremental index is kept.
 */
@Service
public class GraphValidator {

    private static final Logger log = LoggerFactory.getLogger(GraphValidator.class);

    /**
     * Decides whether {@code edge} may be added to a graph that currently
     * holds {@code nodes} and {@code edges}.
     */
    public EdgeValidation validateEdge(GraphEdge edge, Collection<GraphNode> nodes,
                                       Collection<GraphEdge> edges) {
        var nodesById = index(nodes);
        var kindCheck = checkKinds(edge, nodesById);
        if (!kindCheck.valid()) {
            return kindCheck;
        }
        for (var existing : edges) {
            if (!existing.id().equals(edge.id())
                    && existing.source().equals(edge.source())
                    && existing.target().equals(edge.target())) {
                return EdgeValidation.rejected("Edge " + edge.source() + " -> " + edge.target()
                        + " already exists");
            }
        }
        if (isTask(edge.source(), nodesById) && isTask(edge.target(), nodesById)) {
            // Adding source -> target closes a cycle iff source is already reachable from target
            var adjacency = taskAdjacency(edges, nodesById);
            if (isReachable(edge.target(), edge.source(), adjacency)) {
                log.debug("Rejecting edge {} -> {}: would create a cycle", edge.source(), edge.target());
                return EdgeValidation.rejected("Edge " + edge.source() + " -> " + edge.target()
                        + " would create a circular dependency");
            }
        }
        return EdgeValidation.ok();
    }

    /**
     * Whole-graph verdict: every edge obeys the kind rules and the task subgraph is acyclic.
     */
    public EdgeValidation validate(Collection<GraphNode> nodes, Collection<GraphEdge> edges) {
        var nodesById = index(nodes);
        for (var edge : edges) {
            var kindCheck = checkKinds(edge, nodesById);
            if (!kindCheck.valid()) {
                return kindCheck;
            }
        }
        var cycle = findCycle(nodesById.keySet(), taskAdjacency(edges, nodesById));
        if (!cycle.isEmpty()) {
            return EdgeValidation.rejected("Dependency cycle: " + String.join(" -> ", cycle));
        }
        return EdgeValidation.ok();
    }

    /**
     * Drops every edge whose source or target is no longer among {@code nodes}.
     */
    public List<GraphEdge> reconcile(Collection<GraphNode> nodes, Collection<GraphEdge> edges) {
        var nodeIds = new HashSet<String>();
        for (var node : nodes) {
            nodeIds.add(node.id());
        }
        var kept = new ArrayList<GraphEdge>();
        for (var edge : edges) {
            if (nodeIds.contains(edge.source()) && nodeIds.contains(edge.target())) {
                kept.add(edge);
            }
        }
        if (kept.size() != edges.size()) {
            log.info("Reconciled graph: removed {} orphaned edge(s)", edges.size() - kept.size());
        }
        return kept;
    }

    /**
     * Agent nodes followed by task nodes, in workflow order.
     */
    public List<GraphNode> deriveNodes(Workflow workflow) {
        var nodes = new ArrayList<GraphNode>();
        for (var agent : workflow.agents()) {
            nodes.add(GraphNode.agent(agent.id()));
        }
        for (var task : workflow.tasks()) {
            nodes.add(GraphNode.task(task.id()));
        }
        return nodes;
    }

    /**
     * Edges implied by the workflow definition: one per agent assignment and one
     * per declared dependency. References to missing agents or tasks yield no edge.
     */
    public List<GraphEdge> deriveEdges(Workflow workflow) {
        var agentIds = new HashSet<String>();
        for (var agent : workflow.agents()) {
            agentIds.add(agent.id());
        }
        var taskIds = new HashSet<String>();
        for (var task : workflow.tasks()) {
            taskIds.add(task.id());
        }
        var edges = new ArrayList<GraphEdge>();
        for (var task : workflow.tasks()) {
            if (task.agentId() != null && agentIds.contains(task.agentId())) {
                edges.add(new GraphEdge(task.agentId() + "-" + task.id(), task.agentId(), task.id()));
            }
            for (var dep : new LinkedHashSet<>(task.dependencies())) {
                if (taskIds.contains(dep) && !dep.equals(task.id())) {
                    edges.add(new GraphEdge(dep + "-" + task.id() + "-dep", dep, task.id()));
                }
            }
        }
        return edges;
    }

    /**
     * Checks that a workflow can be run. Reports every violation at once.
     *
     * @throws WorkflowValidationException if any violation is found
     */
    public void validateWorkflow(Workflow workflow) {
        var violations = new ArrayList<String>();
        if (workflow.tasks().isEmpty()) {
            violations.add("Workflow must have at least one task");
        }

        var agentIds = new HashSet<String>();
        for (Agent agent : workflow.agents()) {
            agentIds.add(agent.id());
        }

        var tasksById = new LinkedHashMap<String, Task>();
        for (var task : workflow.tasks()) {
            if (tasksById.putIfAbsent(task.id(), task) != null) {
                violations.add("Duplicate task id " + task.id());
            }
        }

        var adjacency = new LinkedHashMap<String, List<String>>();
        for (var task : tasksById.values()) {
            adjacency.putIfAbsent(task.id(), new ArrayList<>());
            if (task.agentId() == null || !agentIds.contains(task.agentId())) {
                violations.add("Task " + task.id() + " references agent " + task.agentId()
                        + " which is not in the workflow");
            }
            var seen = new HashSet<String>();
            for (var dep : task.dependencies()) {
                if (!seen.add(dep)) {
                    violations.add("Task " + task.id() + " lists dependency " + dep + " more than once");
                } else if (dep.equals(task.id())) {
                    violations.add("Task " + task.id() + " cannot depend on itself");
                } else if (!tasksById.containsKey(dep)) {
                    violations.add("Task " + task.id() + " depends on unknown task " + dep);
                } else {
                    adjacency.computeIfAbsent(dep, k -> new ArrayList<>()).add(task.id());
                }
            }
        }

        var cycle = findCycle(tasksById.keySet(), adjacency);
        if (!cycle.isEmpty()) {
            violations.add("Dependency cycle: " + String.join(" -> ", cycle));
        }

        if (!violations.isEmpty()) {
            log.warn("Workflow {} failed validation with {} violation(s)", workflow.id(), violations.size());
            throw new WorkflowValidationException(workflow.id(), violations);
        }
        log.debug("Workflow {} validated: {} tasks, {} agents",
                workflow.id(), workflow.tasks().size(), workflow.agents().size());
    }

    // -- internals --

    private EdgeValidation checkKinds(GraphEdge edge, Map<String, GraphNode> nodesById) {
        var source = nodesById.get(edge.source());
        var target = nodesById.get(edge.target());
        if (source == null) {
            return EdgeValidation.rejected("Unknown source node " + edge.source());
        }
        if (target == null) {
            return EdgeValidation.rejected("Unknown target node " + edge.target());
        }
        if (source.id().equals(target.id())) {
            return EdgeValidation.rejected("Node " + source.id() + " cannot connect to itself");
        }
        if (source.kind() == NodeKind.AGENT && target.kind() != NodeKind.TASK) {
            return EdgeValidation.rejected("Agent " + source.id() + " can only connect to task nodes");
        }
        if (target.kind() == NodeKind.AGENT) {
            return EdgeValidation.rejected("Agent " + target.id() + " cannot be a dependency target");
        }
        return EdgeValidation.ok();
    }

    private Map<String, GraphNode> index(Collection<GraphNode> nodes) {
        var byId = new LinkedHashMap<String, GraphNode>();
        for (var node : nodes) {
            byId.put(node.id(), node);
        }
        return byId;
    }

    private boolean isTask(String id, Map<String, GraphNode> nodesById) {
        var node = nodesById.get(id);
        return node != null && node.kind() == NodeKind.TASK;
    }

    private Map<String, List<String>> taskAdjacency(Collection<GraphEdge> edges, Map<String, GraphNode> nodesById) {
        var adjacency = new LinkedHashMap<String, List<String>>();
        for (var edge : edges) {
            if (isTask(edge.source(), nodesById) && isTask(edge.target(), nodesById)) {
                adjacency.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
            }
        }
        return adjacency;
    }

    private boolean isReachable(String from, String to, Map<String, List<String>> adjacency) {
        Deque<String> stack = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        stack.push(from);
        while (!stack.isEmpty()) {
            var current = stack.pop();
            if (current.equals(to)) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            for (var next : adjacency.getOrDefault(current, List.of())) {
                if (!visited.contains(next)) {
                    stack.push(next);
                }
            }
        }
        return false;
    }

    /**
     * Returns the node ids of one cycle (first node repeated at the end), or an empty list.
     */
    private List<String> findCycle(Collection<String> nodeIds, Map<String, List<String>> adjacency) {
        var state = new HashMap<String, Integer>(); // 1 = on path, 2 = done
        var path = new ArrayList<String>();
        for (var id : nodeIds) {
            if (!state.containsKey(id)) {
                var cycle = visit(id, adjacency, state, path);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }
        return List.of();
    }

    private List<String> visit(String id, Map<String, List<String>> adjacency,
                               Map<String, Integer> state, List<String> path) {
        state.put(id, 1);
        path.add(id);
        for (var next : adjacency.getOrDefault(id, List.of())) {
            Integer s = state.get(next);
            if (s == null) {
                var cycle = visit(next, adjacency, state, path);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            } else if (s == 1) {
                var cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                return cycle;
            }
        }
        path.remove(path.size() - 1);
        state.put(id, 2);
        return List.of();
    }
}
