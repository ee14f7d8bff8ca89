package com.linlay.agentruntime.tool;

public record ToolResponse(
        String content,
        boolean isError,
        String metadata
) {

    public ToolResponse {
        if (content == null) {
            content = "";
        }
    }

    public static ToolResponse text(String content) {
        return new ToolResponse(content, false, null);
    }

    public static ToolResponse error(String message) {
        return new ToolResponse(message, true, null);
    }

    /**
     * @param metadata JSON text kept for the caller; it is not sent back to the model
     */
    public ToolResponse withMetadata(String metadata) {
        return new ToolResponse(content, isError, metadata);
    }
}
