package com.linlay.agentruntime.service;

import com.linlay.agentruntime.tool.AgentTool;
import com.linlay.agentruntime.tool.ToolRegistry;
import org.springframework.ai.chat.messages.Message;

import java.util.List;
import java.util.Map;

/**
 * Everything one model call needs.
 *
 * @param model          provider model name, {@code null} for the transport default
 * @param responseSchema JSON schema the response must follow, {@code null} for free text
 */
public record ModelRequest(
        String model,
        String systemPrompt,
        List<Message> messages,
        List<FunctionTool> tools,
        Map<String, Object> responseSchema
) {

    public ModelRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public static List<FunctionTool> toolsOf(ToolRegistry registry) {
        if (registry == null || registry.isEmpty()) {
            return List.of();
        }
        return registry.list().stream().map(FunctionTool::from).toList();
    }

    public record FunctionTool(
            String name,
            String description,
            Map<String, Object> parameters
    ) {

        public FunctionTool {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must not be null or blank");
            }
            if (description == null) {
                description = "";
            }
        }

        public static FunctionTool from(AgentTool tool) {
            return new FunctionTool(tool.name(), tool.description(), tool.parametersSchema());
        }
    }
}
