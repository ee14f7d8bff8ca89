package com.linlay.agentruntime.stream.model;

/**
 * Token accounting for one model call, or the sum over a run.
 */
public record Usage(
        long inputTokens,
        long outputTokens,
        long reasoningTokens,
        long totalTokens
) {

    public static final Usage EMPTY = new Usage(0, 0, 0, 0);

    public Usage {
        if (inputTokens < 0 || outputTokens < 0 || reasoningTokens < 0 || totalTokens < 0) {
            throw new IllegalArgumentException("token counts must not be negative");
        }
        if (totalTokens == 0) {
            totalTokens = inputTokens + outputTokens;
        }
    }

    public Usage plus(Usage other) {
        if (other == null) {
            return this;
        }
        return new Usage(
                inputTokens + other.inputTokens,
                outputTokens + other.outputTokens,
                reasoningTokens + other.reasoningTokens,
                totalTokens + other.totalTokens
        );
    }

    /**
     * Overlays the non-zero counts of {@code update}. Vendors report input and output tokens in
     * separate chunks of one response.
     */
    public Usage merge(Usage update) {
        if (update == null) {
            return this;
        }
        long input = update.inputTokens > 0 ? update.inputTokens : inputTokens;
        long output = update.outputTokens > 0 ? update.outputTokens : outputTokens;
        long reasoning = update.reasoningTokens > 0 ? update.reasoningTokens : reasoningTokens;
        return new Usage(input, output, reasoning, Math.max(update.totalTokens, input + output));
    }
}
