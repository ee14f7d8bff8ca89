package com.linlay.agentruntime.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaValidatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SchemaValidator validator = new SchemaValidator(objectMapper);

    private final Map<String, Object> schema = Map.of(
            "type", "object",
            "required", List.of("name"),
            "properties", Map.of(
                    "name", Map.of("type", "string"),
                    "age", Map.of("type", "integer")
            )
    );

    @Test
    void conformingValueShouldPass() throws Exception {
        assertThat(validator.validate(objectMapper.readTree("{\"name\":\"ada\",\"age\":36}"), schema)).isEmpty();
    }

    @Test
    void nullSchemaShouldAcceptAnything() throws Exception {
        assertThat(validator.validate(objectMapper.readTree("[1,2]"), (Map<String, Object>) null)).isEmpty();
    }

    @Test
    void shouldAggregateEveryViolationDeterministically() throws Exception {
        Optional<SchemaValidationException> first = validator.validate(objectMapper.readTree("{\"name\":1,\"age\":\"x\"}"), schema);
        Optional<SchemaValidationException> second = validator.validate(objectMapper.readTree("{\"name\":1,\"age\":\"x\"}"), schema);

        assertThat(first).isPresent();
        assertThat(first.get().violations()).hasSize(2);
        assertThat(first.get().getMessage())
                .startsWith("validation failed: ")
                .contains("name")
                .contains("age")
                .contains("; ");
        assertThat(second.get().getMessage()).isEqualTo(first.get().getMessage());
    }

    @Test
    void missingRequiredFieldShouldBeReported() throws Exception {
        Optional<SchemaValidationException> error = validator.validate(objectMapper.readTree("{}"), schema);

        assertThat(error).isPresent();
        assertThat(error.get().violations()).singleElement().asString().contains("name");
    }

    @Test
    void mapAndTreeSchemasShouldValidateAlike() throws Exception {
        JsonNode schemaNode = objectMapper.readTree(
                "{\"type\":\"object\",\"required\":[\"name\"],\"properties\":{\"name\":{\"type\":\"string\"}}}");
        JsonNode value = objectMapper.readTree("{\"name\":7}");

        Optional<SchemaValidationException> fromTree = validator.validate(value, schemaNode);
        Optional<SchemaValidationException> fromMap = validator.validate(value, schema);

        assertThat(fromTree).isPresent();
        assertThat(fromMap).isPresent();
        assertThat(fromTree.get().violations()).singleElement().asString().contains("name");
    }
}
