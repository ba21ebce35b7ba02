package com.agentflow.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * An execution capability descriptor. Agents are read-only inputs to a run.
 *
 * @param id           unique identifier
 * @param name         display name, used in prompts
 * @param role         the agent's role
 * @param description  free-form description
 * @param capabilities capability labels, listed in prompts
 * @param model        model identifier handed to the capability invoker (nullable)
 * @param temperature  sampling temperature (nullable, provider default when absent)
 * @param maxTokens    response token cap (nullable)
 */
public record Agent(
    String id,
    String name,
    AgentRole role,
    String description,
    List<String> capabilities,
    String model,
    Double temperature,
    Integer maxTokens
) implements Serializable {

    public Agent {
        capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
        role = role != null ? role : AgentRole.CUSTOM;
    }
}
