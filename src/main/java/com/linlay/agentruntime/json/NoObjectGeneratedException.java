package com.linlay.agentruntime.json;

/**
 * Raised when model output could not be turned into a schema-conforming object.
 * Exactly one of {@link #parseError()} and {@link #validationError()} is set.
 */
public class NoObjectGeneratedException extends RuntimeException {

    private final String rawText;
    private final JsonRecoveryException parseError;
    private final SchemaValidationException validationError;

    private NoObjectGeneratedException(
            String message,
            String rawText,
            JsonRecoveryException parseError,
            SchemaValidationException validationError
    ) {
        super(message, parseError != null ? parseError : validationError);
        this.rawText = rawText;
        this.parseError = parseError;
        this.validationError = validationError;
    }

    public static NoObjectGeneratedException parseFailure(String rawText, JsonRecoveryException parseError) {
        return new NoObjectGeneratedException(
                "no object generated: could not parse the response: " + parseError.getMessage(),
                rawText,
                parseError,
                null
        );
    }

    public static NoObjectGeneratedException validationFailure(String rawText, SchemaValidationException validationError) {
        return new NoObjectGeneratedException(
                "no object generated: response did not match schema: " + validationError.getMessage(),
                rawText,
                null,
                validationError
        );
    }

    public String rawText() {
        return rawText;
    }

    public JsonRecoveryException parseError() {
        return parseError;
    }

    public SchemaValidationException validationError() {
        return validationError;
    }

    public boolean isParseFailure() {
        return parseError != null;
    }
}
