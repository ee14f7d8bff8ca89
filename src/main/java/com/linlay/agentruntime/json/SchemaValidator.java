package com.linlay.agentruntime.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Validates parsed values against JSON Schema (draft 2020-12). The schema is compiled on every
 * call; callers validating repeatedly against one schema should cache on their side.
 */
public class SchemaValidator {

    private final ObjectMapper objectMapper;
    private final JsonSchemaFactory schemaFactory;

    public SchemaValidator(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    }

    public Optional<SchemaValidationException> validate(JsonNode value, Map<String, Object> schema) {
        if (schema == null) {
            return Optional.empty();
        }
        JsonNode schemaNode = objectMapper.valueToTree(schema);
        return validate(value, schemaNode);
    }

    public Optional<SchemaValidationException> validate(JsonNode value, JsonNode schema) {
        if (schema == null || schema.isNull() || schema.isMissingNode()) {
            return Optional.empty();
        }
        JsonSchema compiled;
        try {
            compiled = schemaFactory.getSchema(schema);
        } catch (RuntimeException ex) {
            return Optional.of(new SchemaValidationException("invalid schema: " + ex.getMessage(), ex));
        }

        Set<ValidationMessage> messages;
        try {
            messages = compiled.validate(value == null ? objectMapper.nullNode() : value);
        } catch (RuntimeException ex) {
            return Optional.of(new SchemaValidationException("invalid schema: " + ex.getMessage(), ex));
        }
        if (messages.isEmpty()) {
            return Optional.empty();
        }
        List<String> violations = new ArrayList<>(messages.size());
        for (ValidationMessage message : messages) {
            violations.add(message.getMessage());
        }
        return Optional.of(new SchemaValidationException(violations));
    }
}
