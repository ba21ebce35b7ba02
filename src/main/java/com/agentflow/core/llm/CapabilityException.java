package com.agentflow.core.llm;

/**
 * Thrown by a {@link CapabilityInvoker} when the provider reports an error.
 */
public class CapabilityException extends RuntimeException {
    public CapabilityException(String message) {
        super(message);
    }

    public CapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
