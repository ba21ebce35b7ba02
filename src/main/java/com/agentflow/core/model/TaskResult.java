package com.agentflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one attempt (or the final attempt) at running a task.
 * A retry produces a new result that replaces the previous one in the execution.
 *
 * @param taskId           the task this result belongs to
 * @param status           COMPLETED or FAILED for settled results
 * @param output           structured output; null unless completed
 * @param error            failure reason; null unless failed
 * @param retryCount       retries consumed when this result was produced
 * @param startedAt        when the attempt started
 * @param completedAt      when the attempt finished
 * @param retriesExhausted true when the retry policy gave up on the task
 */
public record TaskResult(
    String taskId,
    TaskStatus status,
    Map<String, Object> output,
    String error,
    int retryCount,
    Instant startedAt,
    Instant completedAt,
    boolean retriesExhausted
) implements Serializable {

    public TaskResult {
        output = output != null ? Collections.unmodifiableMap(new LinkedHashMap<>(output)) : null;
    }

    public static TaskResult completed(String taskId, Map<String, Object> output, int retryCount,
                                       Instant startedAt) {
        return new TaskResult(taskId, TaskStatus.COMPLETED, output, null, retryCount,
                startedAt, Instant.now(), false);
    }

    public static TaskResult failed(String taskId, String error, int retryCount, Instant startedAt) {
        return new TaskResult(taskId, TaskStatus.FAILED, null, error, retryCount,
                startedAt, Instant.now(), false);
    }

    /**
     * The result recorded when a task has used up its retry budget.
     */
    public static TaskResult exhausted(TaskResult lastAttempt, int maxRetries) {
        String reason = "Max retries (" + maxRetries + ") exceeded";
        if (lastAttempt.error() != null && !lastAttempt.error().isBlank()) {
            reason += ": " + lastAttempt.error();
        }
        return new TaskResult(lastAttempt.taskId(), TaskStatus.FAILED, null, reason,
                lastAttempt.retryCount(), lastAttempt.startedAt(), lastAttempt.completedAt(), true);
    }

    public boolean isCompleted() {
        return status == TaskStatus.COMPLETED;
    }

    public boolean isFailed() {
        return status == TaskStatus.FAILED;
    }
}
