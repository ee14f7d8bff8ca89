package com.linlay.agentruntime.stream.adapter.openai;

import com.linlay.agentruntime.stream.model.Usage;

import java.util.List;

/**
 * One parsed chat-completions chunk. Any field may be absent.
 */
public record LlmDelta(
        String reasoning,
        String content,
        List<ToolCallDelta> toolCalls,
        String finishReason,
        Usage usage
) {

    public LlmDelta {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }
}
