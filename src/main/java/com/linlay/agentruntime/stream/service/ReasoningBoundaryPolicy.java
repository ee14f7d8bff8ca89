package com.linlay.agentruntime.stream.service;

/**
 * How an adapter decides where a reasoning block ends.
 */
public enum ReasoningBoundaryPolicy {

    /**
     * The vendor sends no boundaries. Reasoning starts on the first non-empty reasoning token and
     * ends as soon as text or a tool call shows up.
     */
    INFER_FROM_CONTENT,

    /**
     * Boundaries come from the vendor's own block start/stop markers, or from the end of the
     * response.
     */
    EXPLICIT
}
