package com.linlay.agentruntime.json;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

public record JsonRecoveryResult(
        JsonNode value,
        ParseState state,
        JsonRecoveryException error
) {

    private static final JsonRecoveryResult UNDEFINED = new JsonRecoveryResult(null, ParseState.UNDEFINED, null);

    public JsonRecoveryResult {
        Objects.requireNonNull(state, "state must not be null");
        if (state == ParseState.FAILED && error == null) {
            throw new IllegalArgumentException("failed result requires an error");
        }
        if ((state == ParseState.SUCCESSFUL || state == ParseState.REPAIRED) && value == null) {
            throw new IllegalArgumentException(state + " result requires a value");
        }
    }

    public static JsonRecoveryResult undefined() {
        return UNDEFINED;
    }

    public static JsonRecoveryResult successful(JsonNode value) {
        return new JsonRecoveryResult(value, ParseState.SUCCESSFUL, null);
    }

    public static JsonRecoveryResult repaired(JsonNode value) {
        return new JsonRecoveryResult(value, ParseState.REPAIRED, null);
    }

    public static JsonRecoveryResult failed(JsonRecoveryException error) {
        return new JsonRecoveryResult(null, ParseState.FAILED, error);
    }

    public boolean parsed() {
        return state == ParseState.SUCCESSFUL || state == ParseState.REPAIRED;
    }
}
