package com.agentflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single unit of work within a workflow, executed by the agent named in {@code agentId}.
 *
 * @param id           unique identifier within the workflow
 * @param name         short human-readable name
 * @param description  what the task should accomplish
 * @param agentId      the agent that must execute this task
 * @param status       current status
 * @param dependencies IDs of tasks that must complete first (ordered, no duplicates)
 * @param input        task-specific input payload
 * @param output       output payload from the last run, if any
 * @param error        error from the last run, if any
 * @param startedAt    when the last run started
 * @param completedAt  when the last run finished
 * @param retryCount   retries consumed so far (starts at 0)
 * @param maxRetries   retries allowed after the first attempt
 */
public record Task(
    String id,
    String name,
    String description,
    String agentId,
    TaskStatus status,
    List<String> dependencies,
    Map<String, Object> input,
    Map<String, Object> output,
    String error,
    Instant startedAt,
    Instant completedAt,
    int retryCount,
    int maxRetries
) implements Serializable {

    public static final int DEFAULT_MAX_RETRIES = 3;

    public Task {
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        input = input != null ? Collections.unmodifiableMap(new LinkedHashMap<>(input)) : Map.of();
        output = output != null ? Collections.unmodifiableMap(new LinkedHashMap<>(output)) : null;
        status = status != null ? status : TaskStatus.PENDING;
    }

    /**
     * Convenience constructor for a pending task with no payloads.
     */
    public Task(String id, String name, String agentId, List<String> dependencies, int maxRetries) {
        this(id, name, "", agentId, TaskStatus.PENDING, dependencies, Map.of(), null,
                null, null, null, 0, maxRetries);
    }

    public Task withRetryCount(int newRetryCount) {
        return new Task(id, name, description, agentId, status, dependencies, input, output,
                error, startedAt, completedAt, newRetryCount, maxRetries);
    }
}
