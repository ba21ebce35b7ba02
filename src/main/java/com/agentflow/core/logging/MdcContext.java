package com.agentflow.core.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * MDC keys for workflow runs: {@code workflowId}, {@code waveNumber},
 * {@code taskId} and {@code agentId}.
 * <p>
 * Each method opens a {@link Scope} that sets its keys and, on close, puts back
 * whatever the thread had before. Scopes nest: a wave scope inside a workflow
 * scope drops only {@code waveNumber} when it closes. Wave branches run on
 * pooled threads, so a task scope must always be closed in the branch.
 */
public final class MdcContext {

    public static final String WORKFLOW_ID = "workflowId";
    public static final String WAVE_NUMBER = "waveNumber";
    public static final String TASK_ID = "taskId";
    public static final String AGENT_ID = "agentId";

    private MdcContext() {}

    public static Scope workflow(String workflowId) {
        return open(Map.of(WORKFLOW_ID, workflowId));
    }

    public static Scope wave(String workflowId, int waveNumber) {
        var keys = new LinkedHashMap<String, String>();
        keys.put(WORKFLOW_ID, workflowId);
        keys.put(WAVE_NUMBER, String.valueOf(waveNumber));
        return open(keys);
    }

    public static Scope task(String workflowId, int waveNumber, String taskId, String agentId) {
        var keys = new LinkedHashMap<String, String>();
        keys.put(WORKFLOW_ID, workflowId);
        keys.put(WAVE_NUMBER, String.valueOf(waveNumber));
        keys.put(TASK_ID, taskId);
        if (agentId != null) {
            keys.put(AGENT_ID, agentId);
        }
        return open(keys);
    }

    private static Scope open(Map<String, String> keys) {
        var previous = new LinkedHashMap<String, String>();
        keys.forEach((key, value) -> {
            previous.put(key, MDC.get(key));
            MDC.put(key, value);
        });
        return () -> previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }

    /** Restores the MDC keys a scope replaced. */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
