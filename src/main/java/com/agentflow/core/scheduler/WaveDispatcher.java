package com.agentflow.core.scheduler;

import com.agentflow.core.events.EventBus;
import com.agentflow.core.events.WorkflowEvent;
import com.agentflow.core.events.WorkflowEventType;
import com.agentflow.core.invoker.InvocationContext;
import com.agentflow.core.invoker.TaskInvoker;
import com.agentflow.core.logging.MdcContext;
import com.agentflow.core.metrics.AgentflowMetrics;
import com.agentflow.core.model.Agent;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskResult;
import com.agentflow.core.model.WorkflowExecution;
import com.agentflow.core.retry.RetryPolicy;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Dispatches every task of a wave concurrently and returns once the whole
 * wave has settled. In-flight invocations are bounded by a semaphore at the
 * configured parallelism.
 * <p>
 * Each branch resolves the task's agent, invokes it, retries it until the
 * result settles and records the result in the execution as soon as it is
 * known, then hands it to the caller's result callback on the branch thread.
 * A branch never throws: unexpected errors become failed results so sibling
 * tasks are unaffected.
 */
@Component
public class WaveDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WaveDispatcher.class);

    private final TaskInvoker taskInvoker;
    private final RetryPolicy retryPolicy;
    private final int parallelism;
    private final EventBus eventBus;
    private final AgentflowMetrics metrics;
    private final ExecutorService executor;

    @Autowired
    public WaveDispatcher(TaskInvoker taskInvoker, RetryPolicy retryPolicy, SchedulerProperties properties,
                          EventBus eventBus, AgentflowMetrics metrics) {
        this(taskInvoker, retryPolicy, properties.effectiveParallelism(), eventBus, metrics);
    }

    WaveDispatcher(TaskInvoker taskInvoker, RetryPolicy retryPolicy, int parallelism) {
        this(taskInvoker, retryPolicy, parallelism, new EventBus(), null);
    }

    WaveDispatcher(TaskInvoker taskInvoker, RetryPolicy retryPolicy, int parallelism,
                   EventBus eventBus, AgentflowMetrics metrics) {
        this.taskInvoker = taskInvoker;
        this.retryPolicy = retryPolicy;
        this.parallelism = parallelism;
        this.eventBus = eventBus;
        this.metrics = metrics;
        var counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "wave-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public List<TaskResult> dispatch(WorkflowExecution execution, int waveNumber, List<Task> wave,
                                     Map<String, Agent> agentsById) {
        return dispatch(execution, waveNumber, wave, agentsById, result -> { });
    }

    /**
     * Runs {@code wave} to completion.
     *
     * @param execution  the live execution; results are recorded into it
     * @param waveNumber 1-based wave index, for logs and events
     * @param wave       the ready tasks
     * @param agentsById the agents supplied for this run
     * @param onResult   called on the branch thread after each result is recorded;
     *                   must not throw
     * @return one settled result per task in {@code wave}
     */
    public List<TaskResult> dispatch(WorkflowExecution execution, int waveNumber, List<Task> wave,
                                     Map<String, Agent> agentsById, Consumer<TaskResult> onResult) {
        if (wave.isEmpty()) {
            return List.of();
        }
        String workflowId = execution.getWorkflowId();
        log.info("Wave {}: dispatching {} task(s) {} (parallelism {})",
                waveNumber, wave.size(), wave.stream().map(Task::id).toList(), parallelism);
        if (metrics != null) {
            metrics.recordWaveWidth(wave.size());
        }

        var semaphore = new Semaphore(parallelism);
        var futures = new ArrayList<CompletableFuture<TaskResult>>();
        for (var task : wave) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> runBranch(execution, waveNumber, task, agentsById.get(task.agentId()), semaphore, onResult),
                    executor));
        }

        // Barrier: the next wave may only start once every branch has settled
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).exceptionally(e -> null).join();

        var results = new ArrayList<TaskResult>();
        for (int i = 0; i < futures.size(); i++) {
            var task = wave.get(i);
            TaskResult result;
            try {
                result = futures.get(i).join();
            } catch (CompletionException e) {
                log.error("Unexpected error collecting result for task {}", task.id(), e);
                result = TaskResult.failed(task.id(), "Dispatch error: " + e.getMessage(),
                        task.retryCount(), null);
                execution.recordResult(result);
                onResult.accept(result);
            }
            results.add(result);
        }

        long failed = results.stream().filter(TaskResult::isFailed).count();
        log.info("Wave {} complete: {} completed, {} failed", waveNumber, results.size() - failed, failed);
        eventBus.publish(WorkflowEvent.ofWorkflow(WorkflowEventType.WAVE_COMPLETED, workflowId,
                Map.of("wave", waveNumber, "completed", results.size() - failed, "failed", failed)));
        return results;
    }

    private TaskResult runBranch(WorkflowExecution execution, int waveNumber, Task task, Agent agent,
                                 Semaphore semaphore, Consumer<TaskResult> onResult) {
        try (var ignored = MdcContext.task(execution.getWorkflowId(), waveNumber, task.id(), task.agentId())) {
            TaskResult result;
            try {
                result = settle(execution, task, agent, semaphore);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result = failure(task, "Interrupted: " + e.getMessage());
            } catch (Exception e) {
                log.error("Infrastructure error dispatching task {}: {}", task.id(), e.getMessage(), e);
                result = failure(task, e.getMessage());
            }
            execution.recordResult(result);
            publishOutcome(execution.getWorkflowId(), task, result);
            onResult.accept(result);
            return result;
        }
    }

    private TaskResult settle(WorkflowExecution execution, Task task, Agent agent, Semaphore semaphore)
            throws InterruptedException {
        if (agent == null) {
            log.warn("Task {}: agent {} not found, failing without retry", task.id(), task.agentId());
            return TaskResult.failed(task.id(), "Agent not found: " + task.agentId(),
                    task.retryCount(), Instant.now());
        }
        semaphore.acquire();
        try {
            return invokeWithRetries(execution, task, agent);
        } finally {
            semaphore.release();
        }
    }

    private TaskResult invokeWithRetries(WorkflowExecution execution, Task task, Agent agent) {
        String workflowId = execution.getWorkflowId();
        var context = InvocationContext.forTask(task, execution.getResults(), execution.getWorkflowInput());

        eventBus.publish(WorkflowEvent.of(WorkflowEventType.TASK_STARTED, workflowId, task.id(),
                Map.of("agentId", agent.id(), "role", agent.role().name())));
        long startMs = System.currentTimeMillis();

        var result = taskInvoker.invoke(task, agent, context);
        while (result.isFailed() && !result.retriesExhausted()) {
            if (result.retryCount() < task.maxRetries()) {
                var payload = new HashMap<String, Object>();
                payload.put("attempt", result.retryCount() + 1);
                payload.put("maxRetries", task.maxRetries());
                payload.put("error", result.error() != null ? result.error() : "");
                eventBus.publish(WorkflowEvent.of(WorkflowEventType.TASK_RETRYING, workflowId, task.id(), payload));
            }
            result = retryPolicy.maybeRetry(task, agent, result, context);
        }

        if (metrics != null) {
            metrics.recordTaskExecution(agent.role().name(), result.status().name(),
                    System.currentTimeMillis() - startMs);
        }
        return result;
    }

    private void publishOutcome(String workflowId, Task task, TaskResult result) {
        var payload = new HashMap<String, Object>();
        payload.put("status", result.status().name());
        payload.put("retryCount", result.retryCount());
        if (result.error() != null) {
            payload.put("error", result.error());
        }
        eventBus.publish(WorkflowEvent.of(
                result.isCompleted() ? WorkflowEventType.TASK_COMPLETED : WorkflowEventType.TASK_FAILED,
                workflowId, task.id(), payload));
    }

    private TaskResult failure(Task task, String error) {
        return TaskResult.failed(task.id(), error != null ? error : "Unknown error",
                task.retryCount(), Instant.now());
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
