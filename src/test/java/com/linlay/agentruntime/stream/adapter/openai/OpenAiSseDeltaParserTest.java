package com.linlay.agentruntime.stream.adapter.openai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentruntime.stream.model.Usage;
import com.linlay.agentruntime.stream.service.StreamProtocolException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiSseDeltaParserTest {

    private final OpenAiSseDeltaParser parser = new OpenAiSseDeltaParser(new ObjectMapper());

    @Test
    void shouldParseReasoningContentToolCallsFinishReasonAndUsage() {
        String chunk = """
                data: {"usage":{"prompt_tokens":11,"completion_tokens":7,"completion_tokens_details":{"reasoning_tokens":4}},"choices":[{"delta":{"reasoning_content":"思考","content":"答案","tool_calls":[{"index":0,"id":"call_1","type":"function","function":{"name":"bash","arguments":"{\\"command\\":\\"ls\\"}"}}]},"finish_reason":"stop"}]}
                """;

        LlmDelta delta = parser.parseOrNull(chunk);

        assertThat(delta).isNotNull();
        assertThat(delta.reasoning()).isEqualTo("思考");
        assertThat(delta.content()).isEqualTo("答案");
        assertThat(delta.finishReason()).isEqualTo("stop");
        assertThat(delta.usage()).isEqualTo(new Usage(11, 7, 4, 18));
        assertThat(delta.toolCalls()).hasSize(1);

        ToolCallDelta toolCall = delta.toolCalls().get(0);
        assertThat(toolCall.id()).isEqualTo("call_1");
        assertThat(toolCall.index()).isEqualTo(0);
        assertThat(toolCall.name()).isEqualTo("bash");
        assertThat(toolCall.arguments()).isEqualTo("{\"command\":\"ls\"}");
    }

    @Test
    void shouldReturnDeltaWhenOnlyUsageExistsWithoutChoices() {
        LlmDelta delta = parser.parseOrNull("data: {\"choices\":[],\"usage\":{\"prompt_tokens\":3,\"completion_tokens\":2,\"total_tokens\":5}}");

        assertThat(delta).isNotNull();
        assertThat(delta.reasoning()).isNull();
        assertThat(delta.content()).isNull();
        assertThat(delta.toolCalls()).isEmpty();
        assertThat(delta.usage()).isEqualTo(new Usage(3, 2, 0, 5));
    }

    @Test
    void shouldAcceptReasoningFieldUsedByOpenRouter() {
        LlmDelta delta = parser.parseOrNull("{\"choices\":[{\"delta\":{\"reasoning\":\"hmm\"}}]}");

        assertThat(delta.reasoning()).isEqualTo("hmm");
    }

    @Test
    void shouldIgnoreDoneKeepAliveAndEmptyDeltas() {
        assertThat(parser.parseOrNull("data: [DONE]")).isNull();
        assertThat(parser.parseOrNull(": keep-alive")).isNull();
        assertThat(parser.parseOrNull("   ")).isNull();
        assertThat(parser.parseOrNull("data: {\"choices\":[{\"delta\":{\"role\":\"assistant\"}}]}")).isNull();
    }

    @Test
    void shouldKeepWhitespaceOnlyContent() {
        LlmDelta delta = parser.parseOrNull("data: {\"choices\":[{\"delta\":{\"content\":\"\\n\"}}]}");

        assertThat(delta.content()).isEqualTo("\n");
    }

    @Test
    void shouldRejectMalformedPayloadAndProviderErrors() {
        assertThatThrownBy(() -> parser.parseOrNull("data: {\"choices\":["))
                .isInstanceOf(StreamProtocolException.class)
                .hasMessageContaining("unparseable");
        assertThatThrownBy(() -> parser.parseOrNull("data: {\"error\":{\"message\":\"rate limited\"}}"))
                .isInstanceOf(StreamProtocolException.class)
                .hasMessageContaining("rate limited");
    }
}
