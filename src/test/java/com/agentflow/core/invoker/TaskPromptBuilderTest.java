package com.agentflow.core.invoker;

import com.agentflow.core.model.Agent;
import com.agentflow.core.model.AgentRole;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskPromptBuilderTest {

    private final Agent agent = new Agent("ag1", "Ada", AgentRole.RESEARCHER, "",
            List.of("search", "summarize"), "gpt-4o-mini", null, null);

    @Test
    @DisplayName("prompt names the role, agent, capabilities and task")
    void basicPrompt() {
        var task = new Task("t1", "Collect sources", "Find three papers", "ag1", TaskStatus.PENDING,
                List.of(), Map.of(), null, null, null, null, 0, 3);

        String prompt = TaskPromptBuilder.build(task, agent, Map.of());

        assertTrue(prompt.startsWith("You are a researcher agent named Ada."));
        assertTrue(prompt.contains("Your capabilities: search, summarize"));
        assertTrue(prompt.contains("Task: Collect sources"));
        assertTrue(prompt.contains("Description: Find three papers"));
        assertFalse(prompt.contains("Previous task results:"));
        assertFalse(prompt.contains("Task input:"));
    }

    @Test
    @DisplayName("dependency outputs and task input are rendered as JSON")
    void includesPayloads() {
        var task = new Task("t2", "Summarize", "", "ag1", TaskStatus.PENDING,
                List.of("t1"), Map.of("tone", "formal"), null, null, null, null, 0, 3);

        String prompt = TaskPromptBuilder.build(task, agent, Map.of("t1", Map.of("papers", 3)));

        assertTrue(prompt.contains("Previous task results:"));
        assertTrue(prompt.contains("\"papers\" : 3"));
        assertTrue(prompt.contains("Task input:"));
        assertTrue(prompt.contains("\"tone\" : \"formal\""));
        assertFalse(prompt.contains("Description:"));
    }
}
