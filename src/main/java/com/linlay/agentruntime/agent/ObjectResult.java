package com.linlay.agentruntime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentruntime.stream.model.FinishReason;
import com.linlay.agentruntime.stream.model.Usage;

/**
 * @param value   the validated object
 * @param rawText text the model produced, before recovery
 */
public record ObjectResult(
        JsonNode value,
        String rawText,
        FinishReason finishReason,
        Usage usage
) {
}
