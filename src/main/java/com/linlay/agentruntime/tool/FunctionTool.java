package com.linlay.agentruntime.tool;

import com.linlay.agentruntime.agent.runtime.CancellationSignal;

import java.util.Map;
import java.util.Objects;

final class FunctionTool implements AgentTool {

    private static final Map<String, Object> OPEN_OBJECT_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(),
            "additionalProperties", true
    );

    private final String name;
    private final String description;
    private final Map<String, Object> parametersSchema;
    private final Handler handler;

    FunctionTool(String name, String description, Map<String, Object> parametersSchema, Handler handler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("tool name must not be null or blank");
        }
        this.name = name.trim();
        this.description = description == null ? "" : description;
        this.parametersSchema = parametersSchema == null ? OPEN_OBJECT_SCHEMA : Map.copyOf(parametersSchema);
        this.handler = Objects.requireNonNull(handler, "handler cannot be null");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return parametersSchema;
    }

    @Override
    public ToolResponse invoke(ToolCallRequest call, CancellationSignal cancellation) throws Exception {
        return handler.handle(call, cancellation);
    }
}
