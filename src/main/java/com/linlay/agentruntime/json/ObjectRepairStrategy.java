package com.linlay.agentruntime.json;

/**
 * Caller-supplied last chance to fix model output that failed parsing or validation.
 * Invoked at most once per {@link StructuredOutputPipeline#parseAndValidateWithRepair} call.
 */
@FunctionalInterface
public interface ObjectRepairStrategy {

    String repair(String text, RuntimeException error) throws Exception;
}
