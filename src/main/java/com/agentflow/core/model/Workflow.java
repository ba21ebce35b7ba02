package com.agentflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The workflow aggregate: its task graph, the agents assigned to it and descriptive metadata.
 *
 * @param id          unique identifier
 * @param name        display name
 * @param description free-form description
 * @param status      lifecycle status of the definition
 * @param tasks       every task in the workflow
 * @param agents      every agent tasks may be assigned to
 * @param tags        labels
 * @param metadata    arbitrary key-value data
 * @param createdAt   creation time
 * @param updatedAt   last edit time
 * @param startedAt   when the last run started
 * @param completedAt when the last run finished
 */
public record Workflow(
    String id,
    String name,
    String description,
    WorkflowStatus status,
    List<Task> tasks,
    List<Agent> agents,
    List<String> tags,
    Map<String, Object> metadata,
    Instant createdAt,
    Instant updatedAt,
    Instant startedAt,
    Instant completedAt
) implements Serializable {

    public Workflow {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        agents = agents != null ? List.copyOf(agents) : List.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        status = status != null ? status : WorkflowStatus.DRAFT;
    }

    /**
     * Convenience constructor for a draft workflow with no metadata.
     */
    public Workflow(String id, String name, List<Task> tasks, List<Agent> agents) {
        this(id, name, "", WorkflowStatus.DRAFT, tasks, agents, List.of(), Map.of(),
                null, null, null, null);
    }

    public Workflow withTasks(List<Task> newTasks) {
        return new Workflow(id, name, description, status, newTasks, agents, tags, metadata,
                createdAt, updatedAt, startedAt, completedAt);
    }
}
