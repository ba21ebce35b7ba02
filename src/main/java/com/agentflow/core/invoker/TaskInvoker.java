package com.agentflow.core.invoker;

import com.agentflow.core.llm.CapabilityInvoker;
import com.agentflow.core.llm.CapabilityRequest;
import com.agentflow.core.model.Agent;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskResult;
import com.agentflow.core.scheduler.SchedulerProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a single task against its agent's capability and reports the outcome
 * as a {@link TaskResult}.
 * <p>
 * Capability errors, empty responses and timeouts are returned as failed
 * results, never thrown. The task and agent are not modified.
 */
@Service
public class TaskInvoker {

    private static final Logger log = LoggerFactory.getLogger(TaskInvoker.class);

    static final String DEPENDENCIES_KEY = "dependencies";

    private final CapabilityInvoker capability;
    private final Duration timeout;
    private final ExecutorService invocationExecutor;

    @Autowired
    public TaskInvoker(CapabilityInvoker capability, SchedulerProperties properties) {
        this(capability, properties.invocationTimeout());
    }

    public TaskInvoker(CapabilityInvoker capability, Duration timeout) {
        this.capability = capability;
        this.timeout = timeout;
        var counter = new AtomicInteger();
        this.invocationExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "capability-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Invokes {@code task} with {@code agent}. The caller guarantees that
     * {@code task.agentId()} is {@code agent.id()} and that every dependency
     * has a completed result in {@code context}.
     */
    public TaskResult invoke(Task task, Agent agent, InvocationContext context) {
        Instant startedAt = Instant.now();

        if (agent.model() == null || agent.model().isBlank()) {
            log.warn("Task {}: agent {} has no model configured", task.id(), agent.id());
            return TaskResult.failed(task.id(), "Agent model not configured", task.retryCount(), startedAt);
        }

        var request = new CapabilityRequest(
                agent.model(),
                TaskPromptBuilder.build(task, agent, context.dependencyOutputs()),
                buildContext(task, context),
                agent.temperature(),
                agent.maxTokens());

        log.info("Invoking task {} with agent {} [{}] (attempt {})",
                task.id(), agent.id(), agent.model(), task.retryCount() + 1);

        Future<String> call = invocationExecutor.submit(() -> capability.invoke(request));
        String raw;
        try {
            raw = awaitResponse(call);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Task {} timed out after {}ms", task.id(), timeout.toMillis());
            return TaskResult.failed(task.id(), "Invocation timed out after " + timeout.toMillis() + "ms",
                    task.retryCount(), startedAt);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            log.warn("Task {} capability error: {}", task.id(), message);
            return TaskResult.failed(task.id(), message, task.retryCount(), startedAt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return TaskResult.failed(task.id(), "Interrupted: " + e.getMessage(), task.retryCount(), startedAt);
        }

        Map<String, Object> output = TaskOutputParser.parse(raw);
        log.info("Task {} completed ({} output key(s))", task.id(), output.size());
        return TaskResult.completed(task.id(), output, task.retryCount(), startedAt);
    }

    private String awaitResponse(Future<String> call)
            throws InterruptedException, ExecutionException, TimeoutException {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return call.get();
        }
        return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Workflow input, then task input, then the dependency outputs under {@code "dependencies"};
     * later entries win on key clashes.
     */
    private Map<String, Object> buildContext(Task task, InvocationContext context) {
        var merged = new LinkedHashMap<String, Object>(context.workflowInput());
        merged.putAll(task.input());
        merged.put(DEPENDENCIES_KEY, context.dependencyOutputs());
        return merged;
    }

    @PreDestroy
    public void shutdown() {
        invocationExecutor.shutdownNow();
    }
}
