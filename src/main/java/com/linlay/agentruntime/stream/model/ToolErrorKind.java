package com.linlay.agentruntime.stream.model;

/**
 * Why a tool result is an error. {@link #NONE} for successful results.
 */
public enum ToolErrorKind {
    NONE,
    UNKNOWN_TOOL,
    INVALID_ARGUMENTS,
    EXECUTION_FAILED,
    TIMEOUT,
    CANCELLED
}
