package com.linlay.agentruntime.json;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Recovery followed by schema validation, with an optional single repair attempt.
 */
public class StructuredOutputPipeline {

    private static final Logger log = LoggerFactory.getLogger(StructuredOutputPipeline.class);

    private final JsonRecoveryEngine recoveryEngine;
    private final SchemaValidator schemaValidator;

    public StructuredOutputPipeline(JsonRecoveryEngine recoveryEngine, SchemaValidator schemaValidator) {
        this.recoveryEngine = Objects.requireNonNull(recoveryEngine, "recoveryEngine cannot be null");
        this.schemaValidator = Objects.requireNonNull(schemaValidator, "schemaValidator cannot be null");
    }

    public JsonRecoveryEngine recoveryEngine() {
        return recoveryEngine;
    }

    /**
     * @throws NoObjectGeneratedException when the text cannot be parsed (empty text included) or
     *                                    the parsed value violates {@code schema}
     */
    public JsonNode parseAndValidate(String text, Map<String, Object> schema) {
        JsonRecoveryResult recovered = recoveryEngine.recover(text);
        if (recovered.state() == ParseState.UNDEFINED) {
            throw NoObjectGeneratedException.parseFailure(text, new JsonRecoveryException("no content to parse"));
        }
        if (recovered.state() == ParseState.FAILED) {
            throw NoObjectGeneratedException.parseFailure(text, recovered.error());
        }
        JsonNode value = recovered.value();
        schemaValidator.validate(value, schema).ifPresent(error -> {
            throw NoObjectGeneratedException.validationFailure(text, error);
        });
        return value;
    }

    /**
     * Like {@link #parseAndValidate(String, Map)}, but a failure gives {@code repair} one chance to
     * rewrite the text. A failure of the second attempt is reported with the repaired text and the
     * second attempt's error.
     */
    public JsonNode parseAndValidateWithRepair(String text, Map<String, Object> schema, ObjectRepairStrategy repair) {
        Objects.requireNonNull(repair, "repair cannot be null");
        NoObjectGeneratedException firstFailure;
        try {
            return parseAndValidate(text, schema);
        } catch (NoObjectGeneratedException ex) {
            firstFailure = ex;
        }

        RuntimeException firstError = firstFailure.isParseFailure()
                ? firstFailure.parseError()
                : firstFailure.validationError();
        String repairedText;
        try {
            repairedText = repair.repair(text, firstError);
        } catch (Exception ex) {
            log.warn("Object repair strategy failed: {}", ex.getMessage());
            firstFailure.addSuppressed(ex);
            throw firstFailure;
        }
        return parseAndValidate(repairedText, schema);
    }
}
