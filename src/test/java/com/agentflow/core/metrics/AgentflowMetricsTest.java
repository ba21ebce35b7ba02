package com.agentflow.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AgentflowMetricsTest {

    private SimpleMeterRegistry registry;
    private AgentflowMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AgentflowMetrics(registry);
    }

    @Test
    @DisplayName("recordTaskExecution records by role and status")
    void recordTaskExecution() {
        metrics.recordTaskExecution("ANALYST", "COMPLETED", 1500);
        var timer = registry.find("agentflow.task.duration")
                .tag("role", "ANALYST").tag("status", "COMPLETED").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(1500.0, timer.totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("recordWorkflowResult increments the counter for the status")
    void recordWorkflowResult() {
        metrics.recordWorkflowResult("COMPLETED");
        metrics.recordWorkflowResult("COMPLETED");
        metrics.recordWorkflowResult("FAILED");

        assertEquals(2.0, registry.find("agentflow.workflows.total").tag("status", "COMPLETED").counter().count());
        assertEquals(1.0, registry.find("agentflow.workflows.total").tag("status", "FAILED").counter().count());
    }

    @Test
    @DisplayName("recordWaveWidth feeds a distribution summary")
    void recordWaveWidth() {
        metrics.recordWaveWidth(1);
        metrics.recordWaveWidth(3);
        var summary = registry.find("agentflow.wave.width").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(3.0, summary.max());
    }

    @Test
    @DisplayName("incrementDeadlocks and recordRetry count")
    void counters() {
        metrics.incrementDeadlocks();
        metrics.recordRetry("REVIEWER");
        metrics.recordRetry("REVIEWER");
        assertEquals(1.0, registry.find("agentflow.workflows.deadlocks").counter().count());
        assertEquals(2.0, registry.find("agentflow.task.retries").tag("role", "REVIEWER").counter().count());
    }
}
