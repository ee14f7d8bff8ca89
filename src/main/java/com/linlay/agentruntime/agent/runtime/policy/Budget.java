package com.linlay.agentruntime.agent.runtime.policy;

import java.time.Duration;

/**
 * Limits applied to one run. Missing or non-positive values fall back to {@link #DEFAULT}.
 *
 * @param maxSteps    number of model calls a run may make
 * @param runTimeout  wall-clock deadline for the whole run, {@code null} for none
 * @param toolTimeout limit for a single tool invocation
 */
public record Budget(
        int maxSteps,
        Duration runTimeout,
        Duration toolTimeout
) {

    private static final int DEFAULT_MAX_STEPS = 6;
    private static final Duration DEFAULT_TOOL_TIMEOUT = Duration.ofMinutes(2);

    public static final Budget DEFAULT = new Budget(DEFAULT_MAX_STEPS, null, DEFAULT_TOOL_TIMEOUT);

    public Budget {
        maxSteps = maxSteps > 0 ? maxSteps : DEFAULT_MAX_STEPS;
        runTimeout = isPositive(runTimeout) ? runTimeout : null;
        toolTimeout = isPositive(toolTimeout) ? toolTimeout : DEFAULT_TOOL_TIMEOUT;
    }

    public Budget withMaxSteps(int maxSteps) {
        return new Budget(maxSteps, runTimeout, toolTimeout);
    }

    public Budget withRunTimeout(Duration runTimeout) {
        return new Budget(maxSteps, runTimeout, toolTimeout);
    }

    public Budget withToolTimeout(Duration toolTimeout) {
        return new Budget(maxSteps, runTimeout, toolTimeout);
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative();
    }
}
