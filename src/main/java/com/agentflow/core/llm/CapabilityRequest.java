package com.agentflow.core.llm;

import java.util.Map;

/**
 * One capability invocation.
 *
 * @param modelId     model identifier taken from the agent
 * @param prompt      the full task prompt
 * @param context     merged workflow input, task input and dependency outputs
 * @param temperature sampling temperature, or null for the provider default
 * @param maxTokens   response token cap, or null for the provider default
 */
public record CapabilityRequest(
    String modelId,
    String prompt,
    Map<String, Object> context,
    Double temperature,
    Integer maxTokens
) {
    public CapabilityRequest {
        context = context != null ? context : Map.of();
    }
}
