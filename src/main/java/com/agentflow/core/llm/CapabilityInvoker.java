package com.agentflow.core.llm;

/**
 * The only I/O boundary of the execution core: runs one prompt against the
 * language-model capability named by {@link CapabilityRequest#modelId()} and
 * returns its raw text.
 * <p>
 * Supplied by the hosting application. The scheduler and task invoker never
 * know which provider is behind it. Failures are reported by throwing; the
 * task invoker turns them into failed task results.
 */
@FunctionalInterface
public interface CapabilityInvoker {

    String invoke(CapabilityRequest request);
}
