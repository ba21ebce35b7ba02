package com.agentflow.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for workflow execution.
 */
@Service
public class AgentflowMetrics {

    private final MeterRegistry registry;

    public AgentflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String agentRole, String status, long ms) {
        Timer.builder("agentflow.task.duration")
                .tag("role", agentRole)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRetry(String agentRole) {
        Counter.builder("agentflow.task.retries")
                .tag("role", agentRole)
                .register(registry)
                .increment();
    }

    /**
     * Records how many tasks were dispatched together in one wave.
     */
    public void recordWaveWidth(int width) {
        DistributionSummary.builder("agentflow.wave.width")
                .register(registry)
                .record(width);
    }

    public void recordWorkflowResult(String status) {
        Counter.builder("agentflow.workflows.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void incrementDeadlocks() {
        Counter.builder("agentflow.workflows.deadlocks")
                .description("Runs aborted because no task could become ready")
                .register(registry)
                .increment();
    }
}
