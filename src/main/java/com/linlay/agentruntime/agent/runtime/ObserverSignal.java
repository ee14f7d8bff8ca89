package com.linlay.agentruntime.agent.runtime;

/**
 * Returned by an event observer to keep receiving events or to end delivery for the step.
 */
public enum ObserverSignal {
    CONTINUE,
    STOP
}
