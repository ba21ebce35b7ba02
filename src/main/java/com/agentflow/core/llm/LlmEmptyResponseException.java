package com.agentflow.core.llm;

/**
 * Thrown when the model returns null or blank content instead of a response.
 */
public class LlmEmptyResponseException extends CapabilityException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
