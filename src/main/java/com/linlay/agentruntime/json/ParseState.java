package com.linlay.agentruntime.json;

/**
 * Outcome of a single {@link JsonRecoveryEngine#recover(String)} attempt.
 */
public enum ParseState {

    /**
     * Input was null or empty.
     */
    UNDEFINED,

    /**
     * Input parsed as-is.
     */
    SUCCESSFUL,

    /**
     * Input parsed only after {@link JsonRepairer} closed or truncated its structure.
     */
    REPAIRED,

    /**
     * Input could not be parsed even after repair.
     */
    FAILED
}
