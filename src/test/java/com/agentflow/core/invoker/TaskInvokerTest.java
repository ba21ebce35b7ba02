package com.agentflow.core.invoker;

import com.agentflow.core.llm.CapabilityException;
import com.agentflow.core.llm.CapabilityInvoker;
import com.agentflow.core.llm.CapabilityRequest;
import com.agentflow.core.model.Agent;
import com.agentflow.core.model.AgentRole;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskResult;
import com.agentflow.core.model.TaskStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TaskInvokerTest {

    private CapabilityInvoker capability;
    private TaskInvoker invoker;

    private final Agent agent = new Agent("ag1", "Ada", AgentRole.ANALYST, "", List.of(),
            "gpt-4o-mini", 0.2, 512);

    @BeforeEach
    void setUp() {
        capability = mock(CapabilityInvoker.class);
        invoker = new TaskInvoker(capability, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        invoker.shutdown();
    }

    private static Task task(String id, List<String> deps, Map<String, Object> input) {
        return new Task(id, "Task " + id, "", "ag1", TaskStatus.PENDING, deps, input,
                null, null, null, null, 0, 3);
    }

    @Test
    @DisplayName("successful call yields a completed result with parsed output")
    void success() {
        when(capability.invoke(any())).thenReturn("{\"answer\": 42}");

        TaskResult result = invoker.invoke(task("t1", List.of(), Map.of()), agent,
                new InvocationContext(Map.of(), Map.of()));

        assertTrue(result.isCompleted());
        assertEquals(Map.of("answer", 42), result.output());
        assertNull(result.error());
        assertEquals(0, result.retryCount());
        assertNotNull(result.startedAt());
        assertNotNull(result.completedAt());
    }

    @Test
    @DisplayName("request carries model settings and merged context")
    void requestShape() {
        when(capability.invoke(any())).thenReturn("done");
        var context = new InvocationContext(Map.of("t0", Map.of("x", 1)), Map.of("topic", "ai", "tone", "casual"));

        invoker.invoke(task("t1", List.of("t0"), Map.of("tone", "formal")), agent, context);

        var captor = ArgumentCaptor.forClass(CapabilityRequest.class);
        verify(capability).invoke(captor.capture());
        var request = captor.getValue();
        assertEquals("gpt-4o-mini", request.modelId());
        assertEquals(0.2, request.temperature());
        assertEquals(512, request.maxTokens());
        assertEquals("ai", request.context().get("topic"));
        assertEquals("formal", request.context().get("tone"), "task input overrides workflow input");
        assertEquals(Map.of("t0", Map.of("x", 1)), request.context().get("dependencies"));
        assertTrue(request.prompt().contains("Previous task results:"));
    }

    @Test
    @DisplayName("capability error becomes a failed result carrying the message")
    void capabilityError() {
        when(capability.invoke(any())).thenThrow(new CapabilityException("rate limited"));

        var result = invoker.invoke(task("t1", List.of(), Map.of()), agent,
                new InvocationContext(Map.of(), Map.of()));

        assertTrue(result.isFailed());
        assertEquals("rate limited", result.error());
        assertNull(result.output());
        assertFalse(result.retriesExhausted());
    }

    @Test
    @DisplayName("agent without a model fails without calling the capability")
    void missingModel() {
        var noModel = new Agent("ag1", "Ada", AgentRole.ANALYST, "", List.of(), null, null, null);

        var result = invoker.invoke(task("t1", List.of(), Map.of()), noModel,
                new InvocationContext(Map.of(), Map.of()));

        assertTrue(result.isFailed());
        assertEquals("Agent model not configured", result.error());
        verifyNoInteractions(capability);
    }

    @Test
    @DisplayName("slow call times out as a failed result")
    void timeout() {
        var fast = new TaskInvoker(capability, Duration.ofMillis(50));
        try {
            when(capability.invoke(any())).thenAnswer(inv -> {
                Thread.sleep(2_000);
                return "late";
            });

            var result = fast.invoke(task("t1", List.of(), Map.of()), agent,
                    new InvocationContext(Map.of(), Map.of()));

            assertTrue(result.isFailed());
            assertEquals("Invocation timed out after 50ms", result.error());
        } finally {
            fast.shutdown();
        }
    }

    @Test
    @DisplayName("retry count of the task is carried into the result")
    void carriesRetryCount() {
        when(capability.invoke(any())).thenReturn("ok");

        var result = invoker.invoke(task("t1", List.of(), Map.of()).withRetryCount(2), agent,
                new InvocationContext(Map.of(), Map.of()));

        assertEquals(2, result.retryCount());
    }
}
