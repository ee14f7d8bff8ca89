package com.linlay.agentruntime.agent;

public enum RunTerminalReason {
    FINISHED,
    MAX_STEPS,
    CANCELLED,
    ERRORED,
    STOPPED
}
