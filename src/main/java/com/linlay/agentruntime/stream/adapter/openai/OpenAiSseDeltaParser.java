package com.linlay.agentruntime.stream.adapter.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentruntime.stream.model.Usage;
import com.linlay.agentruntime.stream.service.StreamProtocolException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses OpenAI-compatible chat-completions SSE chunks. Returns {@code null} for chunks that carry
 * nothing (keep-alives, {@code [DONE]}, empty deltas) and throws {@link StreamProtocolException}
 * for payloads that are not JSON or that report a provider error.
 */
public class OpenAiSseDeltaParser {

    private final ObjectMapper objectMapper;

    public OpenAiSseDeltaParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public LlmDelta parseOrNull(String rawChunk) {
        String payload = normalizePayload(rawChunk);
        if (payload == null) {
            return null;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException ex) {
            throw new StreamProtocolException("unparseable chat-completions chunk: " + abbreviate(payload), ex);
        }
        if (root == null || !root.isObject()) {
            throw new StreamProtocolException("chat-completions chunk is not a JSON object: " + abbreviate(payload));
        }
        JsonNode errorNode = root.get("error");
        if (errorNode != null && !errorNode.isNull()) {
            String message = optionalText(errorNode.isObject() ? errorNode.get("message") : errorNode);
            throw new StreamProtocolException("provider reported error: " + (message == null ? errorNode : message));
        }

        Usage usage = parseUsage(root.get("usage"));
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return usage == null ? null : new LlmDelta(null, null, null, null, usage);
        }

        JsonNode firstChoice = choices.get(0);
        JsonNode deltaNode = firstChoice.path("delta");
        String reasoning = optionalText(deltaNode.get("reasoning_content"));
        if (reasoning == null) {
            reasoning = optionalText(deltaNode.get("reasoning"));
        }
        String content = optionalText(deltaNode.get("content"));
        String finishReason = optionalText(firstChoice.get("finish_reason"));

        List<ToolCallDelta> toolCalls = new ArrayList<>();
        JsonNode toolCallsNode = deltaNode.path("tool_calls");
        if (toolCallsNode.isArray()) {
            for (JsonNode toolCallNode : toolCallsNode) {
                String id = optionalText(toolCallNode.get("id"));
                Integer index = optionalInt(toolCallNode.get("index"));
                String type = optionalText(toolCallNode.get("type"));
                JsonNode functionNode = toolCallNode.path("function");
                String name = optionalText(functionNode.get("name"));
                String arguments = optionalText(functionNode.get("arguments"));
                if (!hasText(id) && index == null && !hasText(name) && !hasText(arguments)) {
                    continue;
                }
                toolCalls.add(new ToolCallDelta(id, index, type, name, arguments));
            }
        }

        boolean empty = isEmpty(reasoning)
                && isEmpty(content)
                && toolCalls.isEmpty()
                && !hasText(finishReason)
                && usage == null;
        if (empty) {
            return null;
        }
        return new LlmDelta(reasoning, content, toolCalls, finishReason, usage);
    }

    private Usage parseUsage(JsonNode usageNode) {
        if (usageNode == null || !usageNode.isObject()) {
            return null;
        }
        long promptTokens = usageNode.path("prompt_tokens").asLong(0);
        long completionTokens = usageNode.path("completion_tokens").asLong(0);
        long totalTokens = usageNode.path("total_tokens").asLong(0);
        long reasoningTokens = usageNode.path("completion_tokens_details").path("reasoning_tokens").asLong(0);
        return new Usage(promptTokens, completionTokens, reasoningTokens, totalTokens);
    }

    private String normalizePayload(String rawChunk) {
        if (!hasText(rawChunk)) {
            return null;
        }
        String payload = rawChunk.trim();
        if (payload.startsWith(":")) {
            // SSE comment / keep-alive
            return null;
        }
        if (payload.startsWith("data:")) {
            payload = payload.substring(5).trim();
        }
        if (!hasText(payload) || "[DONE]".equals(payload)) {
            return null;
        }
        return payload;
    }

    private String optionalText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.toString();
    }

    private Integer optionalInt(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isInt() || node.isLong()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText());
            } catch (NumberFormatException ex) {
                throw new StreamProtocolException("tool call index is not a number: " + node.asText(), ex);
            }
        }
        return null;
    }

    private static String abbreviate(String payload) {
        return payload.length() <= 200 ? payload : payload.substring(0, 200) + "...";
    }

    private static boolean isEmpty(String text) {
        return text == null || text.isEmpty();
    }

    private static boolean hasText(String text) {
        return text != null && !text.isBlank();
    }
}
