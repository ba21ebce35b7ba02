package com.agentflow.core.scheduler;

import com.agentflow.core.events.EventBus;
import com.agentflow.core.events.WorkflowEvent;
import com.agentflow.core.events.WorkflowEventType;
import com.agentflow.core.graph.GraphValidator;
import com.agentflow.core.graph.WorkflowValidationException;
import com.agentflow.core.logging.MdcContext;
import com.agentflow.core.metrics.AgentflowMetrics;
import com.agentflow.core.model.Agent;
import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.model.ProgressListener;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Drives a workflow run wave by wave.
 * <p>
 * Each iteration computes the ready set from the execution's results,
 * dispatches it through the {@link WaveDispatcher}, waits for the whole wave
 * and emits progress after every task result and every wave. A run ends
 * {@code COMPLETED} when every task completed, or {@code FAILED} when a task
 * failed. Tasks left that can never become ready, because a dependency failed
 * or because of a cycle, fail the run with a {@link DeadlockException}.
 * <p>
 * {@link #pause} is cooperative: the wave in flight finishes and is recorded,
 * then {@link #run} (or {@link #resume}) returns the paused execution. The
 * execution can be resumed once that loop has returned.
 */
@Service
public class WorkflowScheduler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowScheduler.class);

    private final GraphValidator graphValidator;
    private final ReadySetCalculator readySetCalculator;
    private final WaveDispatcher waveDispatcher;
    private final EventBus eventBus;
    private final AgentflowMetrics metrics;

    public WorkflowScheduler(GraphValidator graphValidator, ReadySetCalculator readySetCalculator,
                             WaveDispatcher waveDispatcher, EventBus eventBus, AgentflowMetrics metrics) {
        this.graphValidator = graphValidator;
        this.readySetCalculator = readySetCalculator;
        this.waveDispatcher = waveDispatcher;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs {@code workflow} until every task is resolved, the run is paused or stopped,
     * or a deadlock is detected.
     *
     * @param workflow the workflow to run; validated before anything starts
     * @param agents   the agents available at run time
     * @param input    workflow-level input handed to every task
     * @param listener receives the execution at every state change (nullable)
     * @return the execution: terminal, or paused
     * @throws WorkflowValidationException if the workflow is not executable
     * @throws DeadlockException           if tasks remain that can never become ready,
     *                                     because a dependency failed or a cycle bypassed validation
     */
    public WorkflowExecution run(Workflow workflow, List<Agent> agents, Map<String, Object> input,
                                 ProgressListener listener) {
        try (var ignored = MdcContext.workflow(workflow.id())) {
            graphValidator.validateWorkflow(workflow);

            var execution = new WorkflowExecution(workflow.id(), workflow.tasks().size(), input);
            execution.setListener(listener);
            execution.start();
            try {
                log.info("Starting workflow {} ({}): {} tasks, {} agents",
                        workflow.id(), workflow.name(), workflow.tasks().size(), agents.size());
                eventBus.publish(WorkflowEvent.ofWorkflow(WorkflowEventType.WORKFLOW_STARTED, workflow.id(),
                        Map.of("tasks", workflow.tasks().size(), "name", String.valueOf(workflow.name()))));
                emit(execution);

                return drive(workflow.tasks(), agents, execution);
            } finally {
                execution.releaseController();
            }
        }
    }

    public WorkflowExecution run(Workflow workflow, List<Agent> agents) {
        return run(workflow, agents, Map.of(), null);
    }

    /**
     * Withholds the next wave. Tasks already dispatched still complete and are recorded.
     *
     * @throws IllegalStateException if the execution is not running
     */
    public void pause(WorkflowExecution execution) {
        if (!execution.pause()) {
            throw new IllegalStateException("Can only pause running workflows (workflow "
                    + execution.getWorkflowId() + " is " + execution.getStatus() + ")");
        }
        log.info("Workflow {} paused", execution.getWorkflowId());
        eventBus.publish(WorkflowEvent.ofWorkflow(WorkflowEventType.WORKFLOW_PAUSED, execution.getWorkflowId(),
                Map.of("wave", execution.getWaveCount())));
        emit(execution);
    }

    /**
     * Continues a paused execution with the tasks that have no result yet.
     * Dependency outputs are read from the same execution, so tasks completed
     * before the pause feed the resumed ones.
     *
     * @throws IllegalStateException    if the execution is not paused, or the loop that was
     *                                  running it is still finishing its in-flight wave
     * @throws IllegalArgumentException if the execution belongs to another workflow
     */
    public WorkflowExecution resume(WorkflowExecution execution, Workflow workflow, List<Agent> agents) {
        return resume(execution, workflow, agents, null);
    }

    public WorkflowExecution resume(WorkflowExecution execution, Workflow workflow, List<Agent> agents,
                                    ProgressListener listener) {
        if (!execution.getWorkflowId().equals(workflow.id())) {
            throw new IllegalArgumentException("Execution " + execution.getWorkflowId()
                    + " does not belong to workflow " + workflow.id());
        }
        if (!execution.resume()) {
            if (execution.getStatus() == ExecutionStatus.PAUSED) {
                throw new IllegalStateException("Workflow " + execution.getWorkflowId()
                        + " is paused but still finishing its in-flight wave; resume once run has returned");
            }
            throw new IllegalStateException("Can only resume paused workflows (workflow "
                    + execution.getWorkflowId() + " is " + execution.getStatus() + ")");
        }
        if (listener != null) {
            execution.setListener(listener);
        }
        try (var ignored = MdcContext.workflow(workflow.id())) {
            var remaining = new ArrayList<Task>();
            for (var task : workflow.tasks()) {
                if (!execution.hasResult(task.id())) {
                    remaining.add(task);
                }
            }
            log.info("Resuming workflow {} with {} remaining task(s)", workflow.id(), remaining.size());
            eventBus.publish(WorkflowEvent.ofWorkflow(WorkflowEventType.WORKFLOW_RESUMED, workflow.id(),
                    Map.of("remaining", remaining.size())));
            emit(execution);

            return drive(remaining, agents, execution);
        } finally {
            execution.releaseController();
        }
    }

    /**
     * Finalizes the execution as {@code COMPLETED} whatever the task outcomes.
     * A run loop in progress starts no further wave. No-op on a terminal execution.
     */
    public void stop(WorkflowExecution execution) {
        if (!execution.stop()) {
            log.debug("Workflow {} already terminal ({}), stop ignored",
                    execution.getWorkflowId(), execution.getStatus());
            return;
        }
        log.info("Workflow {} stopped by request", execution.getWorkflowId());
        eventBus.publish(WorkflowEvent.ofWorkflow(WorkflowEventType.WORKFLOW_STOPPED, execution.getWorkflowId(),
                Map.of("wave", execution.getWaveCount())));
        if (metrics != null) {
            metrics.recordWorkflowResult(ExecutionStatus.COMPLETED.name());
        }
        emit(execution);
    }

    // -- the loop --

    private WorkflowExecution drive(List<Task> tasks, List<Agent> agents, WorkflowExecution execution) {
        var agentsById = new LinkedHashMap<String, Agent>();
        for (var agent : agents) {
            agentsById.put(agent.id(), agent);
        }
        var unresolved = new LinkedHashMap<String, Task>();
        for (var task : tasks) {
            if (!execution.hasResult(task.id())) {
                unresolved.put(task.id(), task);
            }
        }

        while (!unresolved.isEmpty()) {
            if (!execution.isRunning()) {
                return withheld(execution, unresolved.size());
            }

            var wave = readySetCalculator.computeReadySet(unresolved.values(), execution.getResults());
            if (wave.isEmpty()) {
                return deadlock(execution, unresolved);
            }

            int waveNumber = execution.beginWave();
            if (waveNumber == 0) {
                return withheld(execution, unresolved.size());
            }
            try (var ignored = MdcContext.wave(execution.getWorkflowId(), waveNumber)) {
                eventBus.publish(WorkflowEvent.ofWorkflow(WorkflowEventType.WAVE_STARTED, execution.getWorkflowId(),
                        Map.of("wave", waveNumber, "tasks", wave.stream().map(Task::id).toList())));
                waveDispatcher.dispatch(execution, waveNumber, wave, agentsById, result -> emit(execution));
            }
            for (var task : wave) {
                unresolved.remove(task.id());
            }
            emit(execution);
        }

        return complete(execution);
    }

    private WorkflowExecution withheld(WorkflowExecution execution, int unresolved) {
        log.info("Workflow {} is {}, not starting another wave ({} task(s) unresolved)",
                execution.getWorkflowId(), execution.getStatus(), unresolved);
        return execution;
    }

    private WorkflowExecution complete(WorkflowExecution execution) {
        var failed = new TreeSet<String>();
        execution.getResults().forEach((id, result) -> {
            if (result.isFailed()) {
                failed.add(id);
            }
        });
        var status = failed.isEmpty() ? ExecutionStatus.COMPLETED : ExecutionStatus.FAILED;
        String runError = failed.isEmpty() ? null : "Task(s) " + failed + " failed";
        if (!execution.finish(status, runError)) {
            return execution;
        }
        var summary = execution.summary();
        log.info("Workflow {} {}: {} completed, {} failed ({} waves)",
                execution.getWorkflowId(), status, summary.completed(), summary.failed(), execution.getWaveCount());
        eventBus.publish(WorkflowEvent.ofWorkflow(
                failed.isEmpty() ? WorkflowEventType.WORKFLOW_COMPLETED : WorkflowEventType.WORKFLOW_FAILED,
                execution.getWorkflowId(),
                Map.of("completed", summary.completed(), "failed", summary.failed(), "notRun", summary.pending())));
        if (metrics != null) {
            metrics.recordWorkflowResult(status.name());
        }
        emit(execution);
        return execution;
    }

    /**
     * Fails a run whose remaining tasks can never become ready. Tasks behind a
     * failed dependency are reported as blocked; any others wait on a cycle.
     */
    private WorkflowExecution deadlock(WorkflowExecution execution, Map<String, Task> unresolved) {
        var results = execution.getResults();
        Set<String> blocked = readySetCalculator.computeBlocked(unresolved.values(), results);
        var blockedInOrder = new ArrayList<String>();
        var cyclic = new ArrayList<String>();
        var failedDependencies = new TreeSet<String>();
        for (var task : unresolved.values()) {
            if (!blocked.contains(task.id())) {
                cyclic.add(task.id());
                continue;
            }
            blockedInOrder.add(task.id());
            for (var dep : task.dependencies()) {
                var result = results.get(dep);
                if (result != null && result.isFailed()) {
                    failedDependencies.add(dep);
                }
            }
        }

        var reasons = new ArrayList<String>();
        if (!blockedInOrder.isEmpty()) {
            reasons.add(blockedInOrder + " can never run, failed dependency " + failedDependencies);
        }
        if (!cyclic.isEmpty()) {
            reasons.add("no task can become ready; " + cyclic + " wait on a circular dependency");
        }
        String message = "Deadlock: " + String.join("; ", reasons);

        if (!execution.finish(ExecutionStatus.FAILED, message)) {
            return execution;
        }
        execution.markBlocked(blocked);
        log.error("Workflow {} aborted. {}", execution.getWorkflowId(), message);
        eventBus.publish(WorkflowEvent.ofWorkflow(WorkflowEventType.WORKFLOW_FAILED, execution.getWorkflowId(),
                Map.of("reason", "deadlock", "blocked", List.copyOf(blockedInOrder), "cyclic", List.copyOf(cyclic))));
        if (metrics != null) {
            metrics.incrementDeadlocks();
            metrics.recordWorkflowResult(ExecutionStatus.FAILED.name());
        }
        emit(execution);
        throw new DeadlockException(message, execution);
    }

    private void emit(WorkflowExecution execution) {
        try {
            execution.getListener().onProgress(execution);
        } catch (Exception e) {
            log.warn("Progress listener threw for workflow {}: {}", execution.getWorkflowId(), e.getMessage(), e);
        }
    }
}
