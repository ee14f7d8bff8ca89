package com.linlay.agentruntime.agent;

public enum StepOutcome {
    FINISH,
    TOOL_CALLS_PENDING,
    ERROR,
    CANCELLED,
    STOPPED
}
