package com.linlay.agentruntime.tool;

import com.linlay.agentruntime.agent.runtime.CancellationSignal;

import java.util.Map;

public interface AgentTool {

    String name();

    default String description() {
        return "";
    }

    /**
     * JSON Schema of the arguments object. Arguments are validated against it before
     * {@link #invoke} is called.
     */
    default Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(),
                "additionalProperties", true
        );
    }

    /**
     * Runs the tool. Implementations that block should honour thread interruption or poll
     * {@code cancellation}; a thrown exception becomes an error result for the model.
     */
    ToolResponse invoke(ToolCallRequest call, CancellationSignal cancellation) throws Exception;

    static AgentTool of(String name, String description, Map<String, Object> parametersSchema, Handler handler) {
        return new FunctionTool(name, description, parametersSchema, handler);
    }

    @FunctionalInterface
    interface Handler {
        ToolResponse handle(ToolCallRequest call, CancellationSignal cancellation) throws Exception;
    }
}
