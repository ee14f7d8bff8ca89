package com.linlay.agentruntime.stream.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentruntime.model.ProviderProtocol;
import com.linlay.agentruntime.stream.adapter.anthropic.AnthropicStreamNormalizer;
import com.linlay.agentruntime.stream.adapter.openai.OpenAiStreamNormalizer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StreamNormalizerFactoryTest {

    private final StreamNormalizerFactory factory = new StreamNormalizerFactory(new ObjectMapper(), null);

    @Test
    void shouldCreateAdapterPerProtocol() {
        assertThat(factory.create(ProviderProtocol.OPENAI)).isInstanceOf(OpenAiStreamNormalizer.class);
        assertThat(factory.create(ProviderProtocol.ANTHROPIC)).isInstanceOf(AnthropicStreamNormalizer.class);
        assertThat(factory.create(null)).isInstanceOf(OpenAiStreamNormalizer.class);
    }

    @Test
    void shouldNeverShareNormalizerState() {
        StreamNormalizer first = factory.create(ProviderProtocol.OPENAI);
        StreamNormalizer second = factory.create(ProviderProtocol.OPENAI);

        first.normalize("data: {oops");

        assertThat(first).isNotSameAs(second);
        assertThat(first.terminated()).isTrue();
        assertThat(second.terminated()).isFalse();
    }
}
