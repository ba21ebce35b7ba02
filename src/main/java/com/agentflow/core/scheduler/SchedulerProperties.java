package com.agentflow.core.scheduler;

import com.agentflow.core.model.ExecutionStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "agentflow.scheduler")
public class SchedulerProperties {

    private ExecutionStrategy strategy = ExecutionStrategy.PARALLEL;
    private int maxParallel = 8;
    private int invocationTimeoutSeconds = 120;
    private long retryBackoffMillis = 0;

    public ExecutionStrategy getStrategy() { return strategy; }
    public void setStrategy(ExecutionStrategy strategy) { this.strategy = strategy; }

    public int getMaxParallel() { return maxParallel; }
    public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }

    public int getInvocationTimeoutSeconds() { return invocationTimeoutSeconds; }
    public void setInvocationTimeoutSeconds(int invocationTimeoutSeconds) {
        this.invocationTimeoutSeconds = invocationTimeoutSeconds;
    }

    public long getRetryBackoffMillis() { return retryBackoffMillis; }
    public void setRetryBackoffMillis(long retryBackoffMillis) { this.retryBackoffMillis = retryBackoffMillis; }

    /**
     * In-flight invocation bound for one wave: 1 for SEQUENTIAL, maxParallel otherwise.
     */
    public int effectiveParallelism() {
        return strategy == ExecutionStrategy.SEQUENTIAL ? 1 : Math.max(1, maxParallel);
    }

    /**
     * Per-invocation timeout; zero or negative disables it.
     */
    public Duration invocationTimeout() {
        return Duration.ofSeconds(invocationTimeoutSeconds);
    }
}
