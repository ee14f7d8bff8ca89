package com.linlay.agentruntime.stream.adapter.openai;

public record ToolCallDelta(
        String id,
        Integer index,
        String type,
        String name,
        String arguments
) {

    public ToolCallDelta {
        if (type == null || type.isBlank()) {
            type = "function";
        }
    }
}
