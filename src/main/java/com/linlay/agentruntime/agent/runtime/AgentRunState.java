package com.linlay.agentruntime.agent.runtime;

public enum AgentRunState {
    IDLE,
    REQUESTING_GENERATION,
    CONSUMING_EVENTS,
    DISPATCHING_TOOLS,
    FINISHED,
    ERRORED,
    CANCELLED,
    STOPPED;

    public boolean isTerminal() {
        return this == FINISHED || this == ERRORED || this == CANCELLED || this == STOPPED;
    }
}
