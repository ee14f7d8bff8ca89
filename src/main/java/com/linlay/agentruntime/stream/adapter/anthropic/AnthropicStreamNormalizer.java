package com.linlay.agentruntime.stream.adapter.anthropic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentruntime.stream.model.FinishReason;
import com.linlay.agentruntime.stream.model.StreamEvent;
import com.linlay.agentruntime.stream.model.Usage;
import com.linlay.agentruntime.stream.service.AbstractStreamNormalizer;
import com.linlay.agentruntime.stream.service.StreamProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Normalizer for Anthropic messages streams. Block boundaries are explicit
 * ({@code content_block_start} / {@code content_block_stop}), so reasoning is never inferred.
 * Block ids are {@code block-<index>}; tool-use blocks keep the vendor id.
 */
public class AnthropicStreamNormalizer extends AbstractStreamNormalizer {

    private static final Logger log = LoggerFactory.getLogger(AnthropicStreamNormalizer.class);

    private final ObjectMapper objectMapper;
    private final Map<Integer, String> indexedBlockIds = new HashMap<>();

    public AnthropicStreamNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    @Override
    protected void consume(String rawChunk, List<StreamEvent> events) {
        JsonNode root = parsePayload(rawChunk);
        if (root == null) {
            return;
        }
        String type = root.path("type").asText("");
        switch (type) {
            case "message_start" -> recordUsage(parseUsage(root.path("message").path("usage")));
            case "content_block_start" -> startBlock(root, events);
            case "content_block_delta" -> deltaBlock(root, events);
            case "content_block_stop" -> closeBlock(blockId(root), events);
            case "message_delta" -> {
                JsonNode stopReason = root.path("delta").path("stop_reason");
                if (stopReason.isTextual()) {
                    recordFinishReason(mapFinishReason(stopReason.asText()));
                }
                recordUsage(parseUsage(root.path("usage")));
            }
            case "message_stop" -> {
                closeOpenBlocks(events);
                emitFinish(events);
            }
            case "error" -> {
                JsonNode error = root.path("error");
                throw new StreamProtocolException("provider reported error: "
                        + error.path("type").asText("error") + ": " + error.path("message").asText(""));
            }
            case "ping" -> {
                // keep-alive
            }
            default -> log.debug("Ignoring unknown Anthropic stream event type: {}", type);
        }
    }

    private void startBlock(JsonNode root, List<StreamEvent> events) {
        int index = index(root);
        JsonNode contentBlock = root.path("content_block");
        String blockType = contentBlock.path("type").asText("");
        String id = "tool_use".equals(blockType) && contentBlock.hasNonNull("id")
                ? contentBlock.get("id").asText()
                : "block-" + index;
        if (indexedBlockIds.containsKey(index)) {
            // a second start for one index must hit the reopen check
            id = indexedBlockIds.get(index);
        }
        switch (blockType) {
            case "text" -> {
                openText(id);
                indexedBlockIds.put(index, id);
                String text = contentBlock.path("text").asText("");
                if (!text.isEmpty()) {
                    appendText(id, text, events);
                }
            }
            case "thinking", "redacted_thinking" -> {
                openReasoningLazily(id);
                indexedBlockIds.put(index, id);
                String thinking = contentBlock.path("thinking").asText("");
                if (!thinking.isEmpty()) {
                    appendReasoning(id, thinking, events);
                }
            }
            case "tool_use" -> {
                openToolCall(id, contentBlock.path("name").asText(null), events);
                indexedBlockIds.put(index, id);
                JsonNode input = contentBlock.path("input");
                if (input.isObject() && !input.isEmpty()) {
                    appendToolArguments(id, input.toString(), events);
                }
            }
            default -> throw new StreamProtocolException("unsupported content block type: " + blockType);
        }
    }

    private void deltaBlock(JsonNode root, List<StreamEvent> events) {
        String id = blockId(root);
        JsonNode delta = root.path("delta");
        String deltaType = delta.path("type").asText("");
        switch (deltaType) {
            case "text_delta" -> appendText(id, delta.path("text").asText(""), events);
            case "thinking_delta" -> appendReasoning(id, delta.path("thinking").asText(""), events);
            case "signature_delta" -> {
                if (!blocks.isOpen(id)) {
                    throw new StreamProtocolException("signature for closed content block: " + id);
                }
            }
            case "input_json_delta" -> {
                String partialJson = delta.path("partial_json").asText("");
                if (partialJson.isEmpty() && blocks.isOpen(id)) {
                    return;
                }
                appendToolArguments(id, partialJson, events);
            }
            default -> throw new StreamProtocolException("unsupported content block delta type: " + deltaType);
        }
    }

    private String blockId(JsonNode root) {
        int index = index(root);
        String id = indexedBlockIds.get(index);
        if (id == null) {
            throw new StreamProtocolException("event for content block that was never started: index " + index);
        }
        return id;
    }

    private int index(JsonNode root) {
        JsonNode index = root.get("index");
        if (index == null || !index.canConvertToInt()) {
            throw new StreamProtocolException("content block event without index: " + root);
        }
        return index.asInt();
    }

    private JsonNode parsePayload(String rawChunk) {
        if (rawChunk == null || rawChunk.isBlank()) {
            return null;
        }
        StringBuilder data = new StringBuilder();
        boolean sseFraming = false;
        for (String line : rawChunk.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("event:") || trimmed.startsWith(":") || trimmed.startsWith("id:")) {
                sseFraming = true;
            } else if (trimmed.startsWith("data:")) {
                sseFraming = true;
                data.append(trimmed.substring(5).trim());
            } else if (!sseFraming) {
                data.append(trimmed);
            }
        }
        if (data.isEmpty()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(data.toString());
            if (root == null || !root.isObject()) {
                throw new StreamProtocolException("messages stream payload is not a JSON object: " + data);
            }
            return root;
        } catch (JsonProcessingException ex) {
            throw new StreamProtocolException("unparseable messages stream payload: " + data, ex);
        }
    }

    private Usage parseUsage(JsonNode usageNode) {
        if (usageNode == null || !usageNode.isObject()) {
            return null;
        }
        return new Usage(
                usageNode.path("input_tokens").asLong(0),
                usageNode.path("output_tokens").asLong(0),
                0,
                0
        );
    }

    static FinishReason mapFinishReason(String reason) {
        return switch (reason) {
            case "end_turn", "pause_turn", "stop_sequence" -> FinishReason.STOP;
            case "max_tokens" -> FinishReason.LENGTH;
            case "tool_use" -> FinishReason.TOOL_CALLS;
            case "refusal" -> FinishReason.CONTENT_FILTER;
            default -> FinishReason.OTHER;
        };
    }
}
