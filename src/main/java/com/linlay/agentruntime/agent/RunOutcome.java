package com.linlay.agentruntime.agent;

import java.util.Objects;

/**
 * @param error first fatal error of the run; {@code null} unless the run ended {@link RunTerminalReason#ERRORED}
 */
public record RunOutcome(
        RunTerminalReason terminalReason,
        Throwable error
) {

    public RunOutcome {
        Objects.requireNonNull(terminalReason, "terminalReason cannot be null");
    }
}
