package com.agentflow.core.graph;

/**
 * Verdict of a graph validation.
 *
 * @param valid  whether the edge (or edge set) is acceptable
 * @param reason why it was rejected; null when valid
 */
public record EdgeValidation(boolean valid, String reason) {

    private static final EdgeValidation OK = new EdgeValidation(true, null);

    public static EdgeValidation ok() {
        return OK;
    }

    public static EdgeValidation rejected(String reason) {
        return new EdgeValidation(false, reason);
    }
}
