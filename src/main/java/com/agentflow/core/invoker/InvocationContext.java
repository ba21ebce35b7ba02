package com.agentflow.core.invoker;

import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a task sees of the rest of the run when it is invoked.
 *
 * @param dependencyOutputs outputs of the task's direct dependencies, keyed by dependency task id
 * @param workflowInput     the input the run was started with
 */
public record InvocationContext(
    Map<String, Map<String, Object>> dependencyOutputs,
    Map<String, Object> workflowInput
) {
    public InvocationContext {
        dependencyOutputs = dependencyOutputs != null ? dependencyOutputs : Map.of();
        workflowInput = workflowInput != null ? workflowInput : Map.of();
    }

    /**
     * Collects the outputs of {@code task}'s direct dependencies from {@code results}.
     * Only completed results contribute; transitive ancestors are not included.
     */
    public static InvocationContext forTask(Task task, Map<String, TaskResult> results,
                                            Map<String, Object> workflowInput) {
        var outputs = new LinkedHashMap<String, Map<String, Object>>();
        for (var depId : task.dependencies()) {
            var result = results.get(depId);
            if (result != null && result.isCompleted() && result.output() != null) {
                outputs.put(depId, result.output());
            }
        }
        return new InvocationContext(Collections.unmodifiableMap(outputs), workflowInput);
    }
}
