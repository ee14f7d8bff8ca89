package com.linlay.agentruntime.stream.adapter.openai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentruntime.stream.model.FinishReason;
import com.linlay.agentruntime.stream.model.StreamEvent;
import com.linlay.agentruntime.stream.model.Usage;
import com.linlay.agentruntime.stream.service.ReasoningBoundaryPolicy;
import com.linlay.agentruntime.stream.service.StreamProtocolException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAiStreamNormalizerTest {

    private final OpenAiSseDeltaParser parser = new OpenAiSseDeltaParser(new ObjectMapper());

    @Test
    void shouldInferReasoningBoundariesFromContent() {
        OpenAiStreamNormalizer normalizer = new OpenAiStreamNormalizer(parser, ReasoningBoundaryPolicy.INFER_FROM_CONTENT);

        List<StreamEvent> events = feed(normalizer,
                "data: {\"choices\":[{\"delta\":{\"reasoning_content\":\"a\"}}]}",
                "data: {\"choices\":[{\"delta\":{\"reasoning_content\":\"b\"}}]}",
                "data: {\"choices\":[{\"delta\":{\"content\":\"x\"}}]}"
        );

        assertThat(events).containsExactly(
                new StreamEvent.ReasoningStart("reasoning-1"),
                new StreamEvent.ReasoningDelta("reasoning-1", "a"),
                new StreamEvent.ReasoningDelta("reasoning-1", "b"),
                new StreamEvent.ReasoningEnd("reasoning-1"),
                new StreamEvent.TextDelta("text-1", "x")
        );
        assertThat(normalizer.complete()).containsExactly(new StreamEvent.Finish(FinishReason.UNKNOWN, Usage.EMPTY));
        assertThat(normalizer.terminated()).isTrue();
    }

    @Test
    void shouldNotOpenReasoningForEmptyTokens() {
        OpenAiStreamNormalizer normalizer = new OpenAiStreamNormalizer(parser, ReasoningBoundaryPolicy.INFER_FROM_CONTENT);

        List<StreamEvent> events = feed(normalizer,
                "data: {\"choices\":[{\"delta\":{\"reasoning_content\":\"\",\"content\":\"hi\"}}]}"
        );

        assertThat(events).containsExactly(new StreamEvent.TextDelta("text-1", "hi"));
    }

    @Test
    void shouldEndReasoningWhenToolCallAppears() {
        OpenAiStreamNormalizer normalizer = new OpenAiStreamNormalizer(parser, ReasoningBoundaryPolicy.INFER_FROM_CONTENT);

        List<StreamEvent> events = feed(normalizer,
                "data: {\"choices\":[{\"delta\":{\"reasoning_content\":\"think\"}}]}",
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"call_1\",\"function\":{\"name\":\"weather\",\"arguments\":\"\"}}]}}]}"
        );

        assertThat(events).containsExactly(
                new StreamEvent.ReasoningStart("reasoning-1"),
                new StreamEvent.ReasoningDelta("reasoning-1", "think"),
                new StreamEvent.ReasoningEnd("reasoning-1"),
                new StreamEvent.ToolCallStart("call_1", "weather")
        );
    }

    @Test
    void explicitPolicyShouldKeepReasoningOpenUntilCompletion() {
        OpenAiStreamNormalizer normalizer = new OpenAiStreamNormalizer(parser, ReasoningBoundaryPolicy.EXPLICIT);

        List<StreamEvent> events = feed(normalizer,
                "data: {\"choices\":[{\"delta\":{\"reasoning_content\":\"a\"}}]}",
                "data: {\"choices\":[{\"delta\":{\"content\":\"x\"}}]}"
        );

        assertThat(events).containsExactly(
                new StreamEvent.ReasoningStart("reasoning-1"),
                new StreamEvent.ReasoningDelta("reasoning-1", "a"),
                new StreamEvent.TextDelta("text-1", "x")
        );
        assertThat(normalizer.complete()).containsExactly(
                new StreamEvent.ReasoningEnd("reasoning-1"),
                new StreamEvent.Finish(FinishReason.UNKNOWN, Usage.EMPTY)
        );
    }

    @Test
    void shouldAccumulateToolArgumentsAndFinishOnUsageChunk() {
        OpenAiStreamNormalizer normalizer = new OpenAiStreamNormalizer(parser, ReasoningBoundaryPolicy.INFER_FROM_CONTENT);

        List<StreamEvent> events = feed(normalizer,
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"call_1\",\"type\":\"function\",\"function\":{\"name\":\"weather\",\"arguments\":\"\"}}]}}]}",
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\"{\\\"city\\\":\"}}]}}]}",
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\"\\\"Paris\\\"}\"}}]}}]}",
                "data: {\"choices\":[{\"delta\":{},\"finish_reason\":\"tool_calls\"}]}",
                "data: {\"choices\":[],\"usage\":{\"prompt_tokens\":10,\"completion_tokens\":5,\"total_tokens\":15}}",
                "data: [DONE]"
        );

        assertThat(events).containsExactly(
                new StreamEvent.ToolCallStart("call_1", "weather"),
                new StreamEvent.ToolCallDelta("call_1", "{\"city\":"),
                new StreamEvent.ToolCallDelta("call_1", "\"Paris\"}"),
                new StreamEvent.ToolCallEnd("call_1", "weather", "{\"city\":\"Paris\"}"),
                new StreamEvent.Finish(FinishReason.TOOL_CALLS, new Usage(10, 5, 0, 15))
        );
        assertThat(normalizer.complete()).isEmpty();
    }

    @Test
    void shouldCorrelateParallelToolCallsByIndex() {
        OpenAiStreamNormalizer normalizer = new OpenAiStreamNormalizer(parser, ReasoningBoundaryPolicy.INFER_FROM_CONTENT);

        feed(normalizer,
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"function\":{\"name\":\"a\",\"arguments\":\"{\\\"x\\\"\"}},{\"index\":1,\"function\":{\"name\":\"b\",\"arguments\":\"{}\"}}]}}]}",
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\":1}\"}}]}}]}"
        );

        assertThat(normalizer.complete()).containsExactly(
                new StreamEvent.ToolCallEnd("tool-0", "a", "{\"x\":1}"),
                new StreamEvent.ToolCallEnd("tool-1", "b", "{}"),
                new StreamEvent.Finish(FinishReason.UNKNOWN, Usage.EMPTY)
        );
    }

    @Test
    void finishWithUsageInSameChunkShouldEmitOnce() {
        OpenAiStreamNormalizer normalizer = new OpenAiStreamNormalizer(parser, ReasoningBoundaryPolicy.INFER_FROM_CONTENT);

        List<StreamEvent> events = feed(normalizer,
                "data: {\"choices\":[{\"delta\":{\"content\":\"hi\"},\"finish_reason\":\"stop\"}],\"usage\":{\"prompt_tokens\":2,\"completion_tokens\":1}}"
        );

        assertThat(events).containsExactly(
                new StreamEvent.TextDelta("text-1", "hi"),
                new StreamEvent.Finish(FinishReason.STOP, new Usage(2, 1, 0, 3))
        );
        assertThat(normalizer.complete()).isEmpty();
    }

    @Test
    void malformedChunkShouldYieldSingleErrorAndStopNormalization() {
        OpenAiStreamNormalizer normalizer = new OpenAiStreamNormalizer(parser, ReasoningBoundaryPolicy.INFER_FROM_CONTENT);

        List<StreamEvent> events = feed(normalizer,
                "data: {\"choices\":[{\"delta\":{\"content\":\"x\"}}]}",
                "data: {\"choices\":[{\"delta\"",
                "data: {\"choices\":[{\"delta\":{\"content\":\"y\"}}]}"
        );

        assertThat(events).hasSize(2);
        assertThat(events.get(0)).isEqualTo(new StreamEvent.TextDelta("text-1", "x"));
        assertThat(events.get(1)).isInstanceOfSatisfying(StreamEvent.Error.class,
                error -> assertThat(error.cause()).isInstanceOf(StreamProtocolException.class));
        assertThat(normalizer.terminated()).isTrue();
        assertThat(normalizer.complete()).isEmpty();
    }

    @Test
    void toolCallContinuedAfterCloseShouldBeProtocolError() {
        OpenAiStreamNormalizer normalizer = new OpenAiStreamNormalizer(parser, ReasoningBoundaryPolicy.INFER_FROM_CONTENT);

        List<StreamEvent> events = feed(normalizer,
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"call_1\",\"function\":{\"name\":\"a\",\"arguments\":\"{}\"}}]},\"finish_reason\":\"tool_calls\"}]}",
                "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\"{}\"}}]}}]}"
        );

        StreamEvent last = events.get(events.size() - 1);
        assertThat(last).isInstanceOf(StreamEvent.Error.class);
        assertThat(((StreamEvent.Error) last).cause()).hasMessageContaining("call_1");
        assertThat(events).filteredOn(event -> event instanceof StreamEvent.Error).hasSize(1);
    }

    private List<StreamEvent> feed(OpenAiStreamNormalizer normalizer, String... chunks) {
        List<StreamEvent> events = new ArrayList<>();
        for (String chunk : chunks) {
            events.addAll(normalizer.normalize(chunk));
        }
        return events;
    }
}
