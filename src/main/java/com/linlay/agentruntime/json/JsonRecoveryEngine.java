package com.linlay.agentruntime.json;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Parses possibly incomplete model output. A strict parse is attempted first; when it fails the
 * text goes through {@link JsonRepairer} and is parsed again.
 */
public class JsonRecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(JsonRecoveryEngine.class);

    private final ObjectReader reader;

    public JsonRecoveryEngine(ObjectMapper objectMapper) {
        Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public JsonRecoveryResult recover(String text) {
        if (text == null || text.isEmpty()) {
            return JsonRecoveryResult.undefined();
        }
        try {
            return JsonRecoveryResult.successful(strictParse(text));
        } catch (JsonProcessingException ex) {
            log.debug("Strict JSON parse failed, trying repair: {}", ex.getOriginalMessage());
        }

        String repaired;
        try {
            repaired = JsonRepairer.repair(text);
        } catch (JsonRecoveryException ex) {
            return JsonRecoveryResult.failed(new JsonRecoveryException("JSON could not be repaired", ex));
        }
        try {
            return JsonRecoveryResult.repaired(strictParse(repaired));
        } catch (JsonProcessingException ex) {
            return JsonRecoveryResult.failed(new JsonRecoveryException("repaired JSON is still invalid: " + repaired, ex));
        }
    }

    private JsonNode strictParse(String text) throws JsonProcessingException {
        JsonNode node = reader.readTree(text);
        if (node == null || node.isMissingNode()) {
            throw new JsonParseException(null, "no JSON content");
        }
        return node;
    }
}
