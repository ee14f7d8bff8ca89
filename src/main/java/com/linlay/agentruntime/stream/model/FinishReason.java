package com.linlay.agentruntime.stream.model;

public enum FinishReason {
    STOP,
    LENGTH,
    TOOL_CALLS,
    CONTENT_FILTER,
    ERROR,
    OTHER,
    UNKNOWN
}
