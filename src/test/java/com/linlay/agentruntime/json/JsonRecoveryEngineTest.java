package com.linlay.agentruntime.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonRecoveryEngineTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonRecoveryEngine engine = new JsonRecoveryEngine(objectMapper);

    @Test
    void wellFormedInputShouldParseWithoutRepair() throws Exception {
        List<String> inputs = List.of(
                "{\"a\":[1,2,{\"b\":null}],\"c\":\"d\"}",
                "[true, false, 1.5e3]",
                "\"plain\"",
                "42"
        );
        for (String input : inputs) {
            JsonRecoveryResult result = engine.recover(input);

            assertThat(result.state()).as(input).isEqualTo(ParseState.SUCCESSFUL);
            assertThat(result.error()).isNull();
            assertThat(result.value()).isEqualTo(objectMapper.readTree(input));
        }
    }

    @Test
    void emptyInputShouldBeUndefinedNotAnError() {
        for (String input : new String[]{"", null}) {
            JsonRecoveryResult result = engine.recover(input);

            assertThat(result.state()).isEqualTo(ParseState.UNDEFINED);
            assertThat(result.value()).isNull();
            assertThat(result.error()).isNull();
        }
    }

    @Test
    void truncationAtAnyBraceOrBracketShouldRecover() {
        String full = "{\"a\":{\"b\":[1,2]},\"c\":[3,{\"d\":\"e\"}],\"f\":{}}";
        for (int i = 0; i < full.length(); i++) {
            char c = full.charAt(i);
            if ("{}[]".indexOf(c) < 0) {
                continue;
            }
            String truncated = full.substring(0, i + 1);

            JsonRecoveryResult result = engine.recover(truncated);

            assertThat(result.state()).as(truncated).isIn(ParseState.REPAIRED, ParseState.SUCCESSFUL);
            assertThat(result.value().isObject()).isTrue();
        }
    }

    @Test
    void truncatedObjectShouldKeepCompleteFieldsOnly() throws Exception {
        JsonRecoveryResult result = engine.recover("{\"city\":\"Paris\",\"days\":[1,2],\"unit\":tru");

        assertThat(result.state()).isEqualTo(ParseState.REPAIRED);
        assertThat(result.value()).isEqualTo(objectMapper.readTree("{\"city\":\"Paris\",\"days\":[1,2]}"));
    }

    @Test
    void trailingTokensShouldNotPassStrictParse() throws Exception {
        JsonRecoveryResult result = engine.recover("{\"a\":1} {\"b\":2}");

        assertThat(result.state()).isEqualTo(ParseState.REPAIRED);
        assertThat(result.value()).isEqualTo(objectMapper.readTree("{\"a\":1}"));
    }

    @Test
    void unrecoverableInputShouldFailWithRepairCause() {
        JsonRecoveryResult result = engine.recover("not json at all");

        assertThat(result.state()).isEqualTo(ParseState.FAILED);
        assertThat(result.value()).isNull();
        assertThat(result.error()).isInstanceOf(JsonRecoveryException.class);
        assertThat(result.error().getCause())
                .isInstanceOf(JsonRecoveryException.class)
                .hasMessageContaining("no recoverable JSON prefix");
    }

    @Test
    void syntaxErrorsBeforeEndOfInputShouldFailInsteadOfDroppingData() {
        List<String> inputs = List.of(
                "{'city':'Rome'}",
                "{\"a\":1 \"b\":2}",
                "{\"a\":1,,\"b\":2}",
                "[garbage",
                "{\"x\": undefined, \"y\": 3}"
        );
        for (String input : inputs) {
            JsonRecoveryResult result = engine.recover(input);

            assertThat(result.state()).as(input).isEqualTo(ParseState.FAILED);
            assertThat(result.value()).as(input).isNull();
            assertThat(result.error()).as(input).isInstanceOf(JsonRecoveryException.class);
        }
    }

    @Test
    void stateShouldNotChangeOnceReturned() {
        JsonRecoveryResult first = engine.recover("{\"a\":");
        JsonRecoveryResult second = engine.recover("{\"a\":");

        JsonNode value = first.value();
        assertThat(first.state()).isEqualTo(ParseState.REPAIRED);
        assertThat(first).isEqualTo(second);
        assertThat(value.size()).isZero();
    }
}
