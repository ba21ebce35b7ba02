package com.agentflow.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run-scoped, mutable record of a workflow's progress. Owned by the scheduler
 * for the lifetime of one run; a paused execution must be kept by the caller
 * to resume it.
 * <p>
 * Status changes are serialized on this object. Each task's slot in the
 * results map is written by exactly one dispatch branch per wave.
 * <p>
 * At most one run loop drives an execution at a time. {@link #start()} and
 * {@link #resume()} hand the controller to the caller's loop, which gives it
 * back with {@link #releaseController()} once it has returned. A paused
 * execution whose loop is still waiting for its in-flight wave cannot be
 * resumed yet.
 */
public class WorkflowExecution {

    private final String workflowId;
    private final int totalTasks;
    private final Map<String, Object> workflowInput;
    private final ConcurrentHashMap<String, TaskResult> results = new ConcurrentHashMap<>();
    private final Set<String> blockedTaskIds = ConcurrentHashMap.newKeySet();

    private volatile ExecutionStatus status = ExecutionStatus.PENDING;
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    private volatile double progress;
    private volatile String error;
    private volatile ProgressListener listener = ProgressListener.NONE;
    private volatile int waveCount;
    private boolean controllerActive;

    public WorkflowExecution(String workflowId, int totalTasks, Map<String, Object> workflowInput) {
        this.workflowId = workflowId;
        this.totalTasks = totalTasks;
        this.workflowInput = workflowInput != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(workflowInput))
                : Map.of();
    }

    // -- State transitions --

    public synchronized boolean start() {
        if (status != ExecutionStatus.PENDING) {
            return false;
        }
        status = ExecutionStatus.RUNNING;
        startedAt = Instant.now();
        controllerActive = true;
        return true;
    }

    public synchronized boolean pause() {
        if (status != ExecutionStatus.RUNNING) {
            return false;
        }
        status = ExecutionStatus.PAUSED;
        return true;
    }

    /**
     * Returns false unless paused with no run loop still attached.
     */
    public synchronized boolean resume() {
        if (status != ExecutionStatus.PAUSED || controllerActive) {
            return false;
        }
        status = ExecutionStatus.RUNNING;
        controllerActive = true;
        return true;
    }

    public synchronized void releaseController() {
        controllerActive = false;
    }

    public synchronized boolean isControllerActive() {
        return controllerActive;
    }

    /**
     * Claims the next wave number, or returns 0 when the execution is no longer
     * running. Checked and counted under the same lock as {@link #pause()} and
     * {@link #stop()}, so a wave never starts after either has returned.
     */
    public synchronized int beginWave() {
        if (status != ExecutionStatus.RUNNING) {
            return 0;
        }
        return ++waveCount;
    }

    /**
     * User-requested finalize: completes the execution whatever the task outcomes.
     */
    public synchronized boolean stop() {
        if (status.isTerminal()) {
            return false;
        }
        status = ExecutionStatus.COMPLETED;
        completedAt = Instant.now();
        return true;
    }

    /**
     * Moves a running execution to a terminal state. Returns false when it is
     * no longer running: stopped mid-wave, or paused after its last wave, in
     * which case the pause stands and a resume finalizes it.
     */
    public synchronized boolean finish(ExecutionStatus terminalStatus, String runError) {
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminalStatus);
        }
        if (status != ExecutionStatus.RUNNING) {
            return false;
        }
        status = terminalStatus;
        error = runError;
        completedAt = Instant.now();
        if (terminalStatus == ExecutionStatus.COMPLETED) {
            progress = 100.0;
        }
        return true;
    }

    // -- Results --

    public void recordResult(TaskResult result) {
        results.put(result.taskId(), result);
        progress = totalTasks == 0 ? 100.0 : results.size() * 100.0 / totalTasks;
    }

    public void markBlocked(Set<String> taskIds) {
        blockedTaskIds.addAll(taskIds);
    }

    public ExecutionSummary summary() {
        int completed = 0;
        int failed = 0;
        for (TaskResult r : results.values()) {
            if (r.isCompleted()) completed++;
            else if (r.isFailed()) failed++;
        }
        Instant start = startedAt;
        Instant end = completedAt;
        Long duration = start != null && end != null ? Duration.between(start, end).toMillis() : null;
        return new ExecutionSummary(totalTasks, completed, failed,
                Math.max(0, totalTasks - completed - failed), duration);
    }

    // -- Accessors --

    public String getWorkflowId() { return workflowId; }
    public ExecutionStatus getStatus() { return status; }
    public boolean isRunning() { return status == ExecutionStatus.RUNNING; }
    public Map<String, TaskResult> getResults() { return Collections.unmodifiableMap(results); }
    public TaskResult getResult(String taskId) { return results.get(taskId); }
    public boolean hasResult(String taskId) { return results.containsKey(taskId); }
    public Set<String> getBlockedTaskIds() { return Collections.unmodifiableSet(blockedTaskIds); }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public double getProgress() { return progress; }
    public int getTotalTasks() { return totalTasks; }
    public Map<String, Object> getWorkflowInput() { return workflowInput; }
    public String getError() { return error; }
    public int getWaveCount() { return waveCount; }

    public ProgressListener getListener() { return listener; }

    public void setListener(ProgressListener listener) {
        this.listener = listener != null ? listener : ProgressListener.NONE;
    }

    @Override
    public String toString() {
        return "WorkflowExecution[" + workflowId + ", " + status + ", "
                + results.size() + "/" + totalTasks + " results]";
    }
}
