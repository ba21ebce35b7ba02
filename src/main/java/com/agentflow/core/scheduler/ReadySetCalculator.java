package com.agentflow.core.scheduler;

import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the next wave: the unresolved tasks whose dependencies all have a
 * completed result. Also finds the tasks that can never become ready because
 * a dependency failed.
 */
@Service
public class ReadySetCalculator {

    private static final Logger log = LoggerFactory.getLogger(ReadySetCalculator.class);

    /**
     * @param unresolved tasks without a terminal result, in workflow order
     * @param results    every result recorded in the execution so far
     * @return the ready tasks, in workflow order; empty if none is ready
     */
    public List<Task> computeReadySet(Collection<Task> unresolved, Map<String, TaskResult> results) {
        log.debug("computeReadySet: {} unresolved, {} results", unresolved.size(), results.size());

        var wave = new ArrayList<Task>();
        for (var task : unresolved) {
            if (results.containsKey(task.id())) {
                log.debug("  {} [{}]: already has a result", task.id(), task.agentId());
                continue;
            }
            if (!allDependenciesCompleted(task, results)) {
                log.debug("  {} [{}]: deps unsatisfied: {}", task.id(), task.agentId(), task.dependencies());
                continue;
            }
            log.debug("  {} [{}]: ready (deps: {})", task.id(), task.agentId(), task.dependencies());
            wave.add(task);
        }
        return wave;
    }

    /**
     * Tasks that depend, directly or through other blocked tasks, on a task whose
     * result is FAILED. Such tasks never acquire a result.
     */
    public Set<String> computeBlocked(Collection<Task> unresolved, Map<String, TaskResult> results) {
        var blocked = new LinkedHashSet<String>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (var task : unresolved) {
                if (blocked.contains(task.id()) || results.containsKey(task.id())) {
                    continue;
                }
                for (var dep : task.dependencies()) {
                    var depResult = results.get(dep);
                    if ((depResult != null && depResult.isFailed()) || blocked.contains(dep)) {
                        blocked.add(task.id());
                        changed = true;
                        break;
                    }
                }
            }
        }
        return blocked;
    }

    private boolean allDependenciesCompleted(Task task, Map<String, TaskResult> results) {
        for (var dep : task.dependencies()) {
            var depResult = results.get(dep);
            if (depResult == null || !depResult.isCompleted()) {
                return false;
            }
        }
        return true;
    }
}
