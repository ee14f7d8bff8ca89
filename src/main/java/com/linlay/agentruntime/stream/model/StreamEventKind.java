package com.linlay.agentruntime.stream.model;

public enum StreamEventKind {
    TEXT_DELTA,
    REASONING_START,
    REASONING_DELTA,
    REASONING_END,
    TOOL_CALL_START,
    TOOL_CALL_DELTA,
    TOOL_CALL_END,
    TOOL_RESULT,
    STEP_FINISH,
    ERROR,
    FINISH
}
