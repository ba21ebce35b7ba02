package com.agentflow.core.invoker;

import com.agentflow.core.model.Agent;
import com.agentflow.core.model.Task;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Map;

/**
 * Converts a task, its agent and its dependency outputs into the prompt text.
 * Pure function, no Spring dependencies.
 */
public final class TaskPromptBuilder {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private TaskPromptBuilder() {}

    public static String build(Task task, Agent agent, Map<String, Map<String, Object>> dependencyOutputs) {
        var sb = new StringBuilder();

        sb.append("You are a ").append(agent.role().name().toLowerCase())
          .append(" agent named ").append(agent.name()).append(".\n\n");
        if (!agent.capabilities().isEmpty()) {
            sb.append("Your capabilities: ").append(String.join(", ", agent.capabilities())).append("\n\n");
        }

        sb.append("Task: ").append(task.name()).append("\n");
        if (task.description() != null && !task.description().isBlank()) {
            sb.append("Description: ").append(task.description()).append("\n");
        }
        sb.append("\n");

        if (dependencyOutputs != null && !dependencyOutputs.isEmpty()) {
            sb.append("Previous task results:\n");
            sb.append(toJson(dependencyOutputs)).append("\n\n");
        }

        if (!task.input().isEmpty()) {
            sb.append("Task input:\n");
            sb.append(toJson(task.input())).append("\n\n");
        }

        sb.append("Please complete this task and provide the output in a clear, structured format.");
        return sb.toString();
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            // Payloads come from parsed JSON or user maps; fall back to toString for exotic values
            return String.valueOf(value);
        }
    }
}
