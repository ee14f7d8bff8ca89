package com.linlay.agentruntime.stream.adapter.openai;

import com.linlay.agentruntime.stream.model.FinishReason;
import com.linlay.agentruntime.stream.model.StreamEvent;
import com.linlay.agentruntime.stream.service.AbstractStreamNormalizer;
import com.linlay.agentruntime.stream.service.ReasoningBoundaryPolicy;
import com.linlay.agentruntime.stream.service.StreamProtocolException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Normalizer for OpenAI-compatible chat-completions streams.
 * <p>
 * Text blocks are named {@code text-<n>} and reasoning blocks {@code reasoning-<n>}. Tool calls are
 * correlated by their {@code index} and keep the vendor id, or {@code tool-<index>} when the vendor
 * sends none. Tool calls close when {@code finish_reason} arrives; the finish event waits for the
 * usage chunk that some vendors send separately, or for {@link #complete()}.
 */
public class OpenAiStreamNormalizer extends AbstractStreamNormalizer {

    private final OpenAiSseDeltaParser parser;
    private final ReasoningBoundaryPolicy reasoningPolicy;

    private final Map<Integer, String> indexedToolIds = new HashMap<>();
    private int textCounter;
    private int reasoningCounter;
    private String textId;
    private String reasoningId;
    private boolean usageSeen;

    public OpenAiStreamNormalizer(OpenAiSseDeltaParser parser, ReasoningBoundaryPolicy reasoningPolicy) {
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
        this.reasoningPolicy = reasoningPolicy == null ? ReasoningBoundaryPolicy.INFER_FROM_CONTENT : reasoningPolicy;
    }

    @Override
    protected void consume(String rawChunk, List<StreamEvent> events) {
        LlmDelta delta = parser.parseOrNull(rawChunk);
        if (delta == null) {
            return;
        }

        if (hasText(delta.reasoning())) {
            closeText(events);
            if (reasoningId == null) {
                reasoningId = "reasoning-" + (++reasoningCounter);
                openReasoning(reasoningId, events);
            }
            appendReasoning(reasoningId, delta.reasoning(), events);
        }

        if (hasText(delta.content())) {
            endInferredReasoning(events);
            if (textId == null) {
                textId = "text-" + (++textCounter);
                openText(textId);
            }
            appendText(textId, delta.content(), events);
        }

        if (!delta.toolCalls().isEmpty()) {
            endInferredReasoning(events);
            closeText(events);
            for (int i = 0; i < delta.toolCalls().size(); i++) {
                consumeToolCall(delta.toolCalls().get(i), i, events);
            }
        }

        if (delta.finishReason() != null && !delta.finishReason().isBlank()) {
            recordFinishReason(mapFinishReason(delta.finishReason()));
            reasoningId = null;
            textId = null;
            closeOpenBlocks(events);
        }

        if (delta.usage() != null) {
            usageSeen = true;
            recordUsage(delta.usage());
        }
        if (usageSeen && finishReasonSeen()) {
            emitFinish(events);
        }
    }

    private void consumeToolCall(ToolCallDelta toolCall, int position, List<StreamEvent> events) {
        int index = toolCall.index() != null ? toolCall.index() : position;
        String toolId = indexedToolIds.get(index);
        if (toolId == null) {
            toolId = hasText(toolCall.id()) ? toolCall.id() : "tool-" + index;
            indexedToolIds.put(index, toolId);
            openToolCall(toolId, toolCall.name(), events);
        } else if (!blocks.isOpen(toolId)) {
            throw new StreamProtocolException("tool call continued after it was closed: " + toolId);
        }
        if (hasText(toolCall.arguments())) {
            appendToolArguments(toolId, toolCall.arguments(), events);
        }
    }

    private void endInferredReasoning(List<StreamEvent> events) {
        if (reasoningPolicy != ReasoningBoundaryPolicy.INFER_FROM_CONTENT || reasoningId == null) {
            return;
        }
        String id = reasoningId;
        reasoningId = null;
        closeBlock(id, events);
    }

    private void closeText(List<StreamEvent> events) {
        if (textId == null) {
            return;
        }
        String id = textId;
        textId = null;
        closeBlock(id, events);
    }

    static FinishReason mapFinishReason(String reason) {
        return switch (reason) {
            case "stop" -> FinishReason.STOP;
            case "length" -> FinishReason.LENGTH;
            case "tool_calls", "function_call" -> FinishReason.TOOL_CALLS;
            case "content_filter" -> FinishReason.CONTENT_FILTER;
            default -> FinishReason.OTHER;
        };
    }
}
