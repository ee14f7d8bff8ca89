package com.linlay.agentruntime.tool;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A validated tool call handed to {@link AgentTool#invoke}.
 *
 * @param arguments    arguments after recovery and schema validation
 * @param rawArguments argument text exactly as the model streamed it
 */
public record ToolCallRequest(
        String callId,
        String name,
        JsonNode arguments,
        String rawArguments
) {

    public ToolCallRequest {
        if (callId == null || callId.isBlank()) {
            throw new IllegalArgumentException("callId must not be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (rawArguments == null) {
            rawArguments = "";
        }
    }
}
