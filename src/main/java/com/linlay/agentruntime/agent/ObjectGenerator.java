package com.linlay.agentruntime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentruntime.agent.runtime.ConversationAccumulator;
import com.linlay.agentruntime.json.JsonRecoveryResult;
import com.linlay.agentruntime.json.NoObjectGeneratedException;
import com.linlay.agentruntime.json.StructuredOutputPipeline;
import com.linlay.agentruntime.model.ProviderProtocol;
import com.linlay.agentruntime.service.ModelCallException;
import com.linlay.agentruntime.service.ModelRequest;
import com.linlay.agentruntime.service.ModelTransport;
import com.linlay.agentruntime.stream.model.FinishReason;
import com.linlay.agentruntime.stream.model.StreamEvent;
import com.linlay.agentruntime.stream.model.Usage;
import com.linlay.agentruntime.stream.service.StreamNormalizer;
import com.linlay.agentruntime.stream.service.StreamNormalizerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Generates a structured object with a single model call: the response text is recovered,
 * validated against the request schema and, when that fails, optionally repaired once.
 */
public class ObjectGenerator {

    private static final Logger log = LoggerFactory.getLogger(ObjectGenerator.class);

    private final ModelTransport transport;
    private final StreamNormalizerFactory normalizerFactory;
    private final StructuredOutputPipeline pipeline;

    public ObjectGenerator(ModelTransport transport, StreamNormalizerFactory normalizerFactory, StructuredOutputPipeline pipeline) {
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.normalizerFactory = Objects.requireNonNull(normalizerFactory, "normalizerFactory cannot be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline cannot be null");
    }

    /**
     * Blocks until the model call ends.
     *
     * @throws NoObjectGeneratedException when the text cannot be parsed or does not match the schema
     * @throws ModelCallException         when the model call fails
     * @throws CancellationException      when the request was cancelled before the object was complete
     */
    public ObjectResult generate(ObjectRequest request) {
        Objects.requireNonNull(request, "request cannot be null");
        StringBuilder text = new StringBuilder();
        FinishReason finishReason = FinishReason.UNKNOWN;
        Usage usage = Usage.EMPTY;

        List<StreamEvent> events = normalizedEvents(request).collectList().block();
        for (StreamEvent event : events == null ? List.<StreamEvent>of() : events) {
            if (event instanceof StreamEvent.TextDelta textDelta) {
                text.append(textDelta.delta());
            } else if (event instanceof StreamEvent.Finish finish) {
                finishReason = finish.finishReason();
                usage = finish.usage();
            }
        }
        request.cancellation().throwIfCancelled();

        JsonNode value = validate(text.toString(), request);
        log.debug("Generated object finishReason={}, usage={}", finishReason, usage);
        return new ObjectResult(value, text.toString(), finishReason, usage);
    }

    /**
     * Emits every distinct object recovered from the text received so far, then the validated
     * final object if it differs from the last partial one. Partial objects are not validated.
     */
    public Flux<JsonNode> streamPartialObjects(ObjectRequest request) {
        Objects.requireNonNull(request, "request cannot be null");
        return Flux.defer(() -> {
            StringBuilder text = new StringBuilder();
            AtomicReference<JsonNode> lastEmitted = new AtomicReference<>();
            Flux<JsonNode> partials = normalizedEvents(request).<JsonNode>handle((event, sink) -> {
                if (!(event instanceof StreamEvent.TextDelta textDelta)) {
                    return;
                }
                if (textDelta.delta().isEmpty()) {
                    return;
                }
                text.append(textDelta.delta());
                JsonRecoveryResult recovered = pipeline.recoveryEngine().recover(text.toString());
                if (recovered.parsed() && !recovered.value().equals(lastEmitted.get())) {
                    lastEmitted.set(recovered.value());
                    sink.next(recovered.value());
                }
            });
            Flux<JsonNode> finalObject = Flux.defer(() -> {
                request.cancellation().throwIfCancelled();
                JsonNode value = validate(text.toString(), request);
                return value.equals(lastEmitted.get()) ? Flux.<JsonNode>empty() : Flux.just(value);
            });
            return partials.concatWith(finalObject);
        });
    }

    private Flux<StreamEvent> normalizedEvents(ObjectRequest request) {
        return Flux.defer(() -> {
            ConversationAccumulator conversation = new ConversationAccumulator(request.history(), request.prompt());
            ModelRequest modelRequest = new ModelRequest(
                    request.model(),
                    request.systemPrompt(),
                    conversation.messages(),
                    List.of(),
                    request.schema()
            );
            ProviderProtocol protocol = request.protocol() == null ? transport.protocol() : request.protocol();
            StreamNormalizer normalizer = normalizerFactory.create(protocol);
            return transport.issueModelCall(modelRequest, request.cancellation())
                    .takeUntilOther(request.cancellation().whenCancelled())
                    .concatMapIterable(normalizer::normalize)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(normalizer.complete())))
                    .<StreamEvent>handle((event, sink) -> {
                        if (event instanceof StreamEvent.Error error) {
                            sink.error(error.cause() instanceof RuntimeException runtime
                                    ? runtime
                                    : new ModelCallException("model stream failed", error.cause()));
                            return;
                        }
                        sink.next(event);
                    });
        });
    }

    private JsonNode validate(String text, ObjectRequest request) {
        if (request.repair() == null) {
            return pipeline.parseAndValidate(text, request.schema());
        }
        return pipeline.parseAndValidateWithRepair(text, request.schema(), request.repair());
    }
}
