package com.linlay.agentruntime.stream.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentruntime.model.ProviderProtocol;
import com.linlay.agentruntime.stream.adapter.anthropic.AnthropicStreamNormalizer;
import com.linlay.agentruntime.stream.adapter.openai.OpenAiSseDeltaParser;
import com.linlay.agentruntime.stream.adapter.openai.OpenAiStreamNormalizer;

import java.util.Objects;

/**
 * Creates a fresh normalizer for every model-call response.
 */
public class StreamNormalizerFactory {

    private final OpenAiSseDeltaParser openAiParser;
    private final ObjectMapper objectMapper;
    private final ReasoningBoundaryPolicy openAiReasoningPolicy;

    public StreamNormalizerFactory(ObjectMapper objectMapper, ReasoningBoundaryPolicy openAiReasoningPolicy) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.openAiParser = new OpenAiSseDeltaParser(objectMapper);
        this.openAiReasoningPolicy = openAiReasoningPolicy == null
                ? ReasoningBoundaryPolicy.INFER_FROM_CONTENT
                : openAiReasoningPolicy;
    }

    public StreamNormalizer create(ProviderProtocol protocol) {
        ProviderProtocol effective = protocol == null ? ProviderProtocol.OPENAI : protocol;
        return switch (effective) {
            case OPENAI -> new OpenAiStreamNormalizer(openAiParser, openAiReasoningPolicy);
            case ANTHROPIC -> new AnthropicStreamNormalizer(objectMapper);
        };
    }
}
