package com.linlay.agentruntime.agent;

import com.linlay.agentruntime.stream.model.FinishReason;
import com.linlay.agentruntime.stream.model.StreamEvent;
import com.linlay.agentruntime.stream.model.Usage;

import java.util.List;
import java.util.Objects;

/**
 * One model call of a run and the tool calls it led to.
 *
 * @param events      canonical events of the model call, in arrival order, up to the point delivery ended
 * @param toolCalls   completed tool calls that were dispatched
 * @param toolResults results of {@code toolCalls}, in completion order
 */
public record AgentStep(
        int stepNumber,
        List<StreamEvent> events,
        List<StreamEvent.ToolCallEnd> toolCalls,
        List<StreamEvent.ToolResult> toolResults,
        String text,
        String reasoning,
        FinishReason finishReason,
        Usage usage,
        StepOutcome outcome
) {

    public AgentStep {
        if (stepNumber < 1) {
            throw new IllegalArgumentException("stepNumber must be positive");
        }
        events = events == null ? List.of() : List.copyOf(events);
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        toolResults = toolResults == null ? List.of() : List.copyOf(toolResults);
        text = text == null ? "" : text;
        reasoning = reasoning == null ? "" : reasoning;
        finishReason = finishReason == null ? FinishReason.UNKNOWN : finishReason;
        usage = usage == null ? Usage.EMPTY : usage;
        Objects.requireNonNull(outcome, "outcome cannot be null");
    }
}
