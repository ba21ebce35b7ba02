package com.agentflow.core.model;

/**
 * Counts over a workflow execution, for status displays.
 *
 * @param total      tasks in the workflow
 * @param completed  tasks with a completed result
 * @param failed     tasks with a failed result
 * @param pending    tasks without a result (not yet run, or blocked by a failed dependency)
 * @param durationMs wall-clock run time; null until the run has finished
 */
public record ExecutionSummary(
    int total,
    int completed,
    int failed,
    int pending,
    Long durationMs
) {}
