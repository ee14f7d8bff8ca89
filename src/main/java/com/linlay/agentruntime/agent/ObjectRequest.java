package com.linlay.agentruntime.agent;

import com.linlay.agentruntime.agent.runtime.CancellationSignal;
import com.linlay.agentruntime.json.ObjectRepairStrategy;
import com.linlay.agentruntime.model.ProviderProtocol;
import org.springframework.ai.chat.messages.Message;

import java.util.List;
import java.util.Map;

/**
 * A request for one structured object.
 *
 * @param schema JSON schema the object must satisfy; also sent to the provider as the response format
 * @param repair optional one-shot repair applied when the first parse or validation fails
 */
public record ObjectRequest(
        String model,
        String systemPrompt,
        List<Message> history,
        String prompt,
        Map<String, Object> schema,
        ObjectRepairStrategy repair,
        ProviderProtocol protocol,
        CancellationSignal cancellation
) {

    public ObjectRequest {
        history = history == null ? List.of() : List.copyOf(history);
        if (schema == null || schema.isEmpty()) {
            throw new IllegalArgumentException("schema must not be null or empty");
        }
        if (cancellation == null) {
            cancellation = CancellationSignal.create();
        }
    }

    public static ObjectRequest of(String prompt, Map<String, Object> schema) {
        return new ObjectRequest(null, null, null, prompt, schema, null, null, null);
    }

    public ObjectRequest withRepair(ObjectRepairStrategy repair) {
        return new ObjectRequest(model, systemPrompt, history, prompt, schema, repair, protocol, cancellation);
    }

    public ObjectRequest withSystemPrompt(String systemPrompt) {
        return new ObjectRequest(model, systemPrompt, history, prompt, schema, repair, protocol, cancellation);
    }

    public ObjectRequest withCancellation(CancellationSignal cancellation) {
        return new ObjectRequest(model, systemPrompt, history, prompt, schema, repair, protocol, cancellation);
    }
}
