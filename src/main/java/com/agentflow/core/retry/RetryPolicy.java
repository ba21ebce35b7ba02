package com.agentflow.core.retry;

import com.agentflow.core.invoker.InvocationContext;
import com.agentflow.core.invoker.TaskInvoker;
import com.agentflow.core.metrics.AgentflowMetrics;
import com.agentflow.core.model.Agent;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskResult;
import com.agentflow.core.model.TaskStatus;
import com.agentflow.core.scheduler.SchedulerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Decides whether a failed task gets another attempt.
 * <p>
 * Each call performs at most one re-invocation; the caller loops until the
 * result is no longer failed or {@link TaskResult#retriesExhausted()} is set.
 * The retry count travels in the result, so the task definition is never mutated.
 */
@Service
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final TaskInvoker taskInvoker;
    private final long backoffMillis;
    private final AgentflowMetrics metrics;

    @Autowired
    public RetryPolicy(TaskInvoker taskInvoker, SchedulerProperties properties, AgentflowMetrics metrics) {
        this(taskInvoker, properties.getRetryBackoffMillis(), metrics);
    }

    public RetryPolicy(TaskInvoker taskInvoker) {
        this(taskInvoker, 0L, null);
    }

    public RetryPolicy(TaskInvoker taskInvoker, long backoffMillis, AgentflowMetrics metrics) {
        this.taskInvoker = taskInvoker;
        this.backoffMillis = backoffMillis;
        this.metrics = metrics;
    }

    /**
     * @param task     the task definition (its {@code maxRetries} is the budget)
     * @param agent    the agent assigned to the task
     * @param previous the latest result for the task
     * @param context  dependency outputs and workflow input for re-invocation
     * @return {@code previous} if it did not fail; an exhausted result if the budget
     *         is spent; otherwise the result of one more attempt
     */
    public TaskResult maybeRetry(Task task, Agent agent, TaskResult previous, InvocationContext context) {
        if (!previous.isFailed() || previous.retriesExhausted()) {
            return previous;
        }
        if (previous.retryCount() >= task.maxRetries()) {
            log.warn("Task {} exhausted its retry budget ({}): {}", task.id(), task.maxRetries(), previous.error());
            return TaskResult.exhausted(previous, task.maxRetries());
        }

        int attempt = previous.retryCount() + 1;
        log.info("Retrying task {} ({}/{}) after: {}", task.id(), attempt, task.maxRetries(), previous.error());
        if (metrics != null) {
            metrics.recordRetry(agent.role().name());
        }
        if (backoffMillis > 0) {
            try {
                Thread.sleep(backoffMillis * attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new TaskResult(task.id(), TaskStatus.FAILED, null, "Interrupted before retry",
                        previous.retryCount(), previous.startedAt(), Instant.now(), true);
            }
        }
        return taskInvoker.invoke(task.withRetryCount(attempt), agent, context);
    }
}
