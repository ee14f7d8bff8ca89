package com.linlay.agentruntime.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.agentruntime.agent.runtime.CancellationSignal;
import com.linlay.agentruntime.json.NoObjectGeneratedException;
import com.linlay.agentruntime.json.StructuredOutputPipeline;
import com.linlay.agentruntime.stream.model.StreamEvent;
import com.linlay.agentruntime.stream.model.ToolErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Resolves, validates and runs the completed tool calls of one step.
 * <p>
 * Calls of one batch run concurrently on a dedicated bounded-elastic scheduler. A single call can
 * never fail the batch: unknown tools, invalid arguments, exceptions, timeouts and cancellation
 * all become error results. Results are emitted in completion order.
 */
public class ToolDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final StructuredOutputPipeline pipeline;
    private final ObjectMapper objectMapper;
    private final Duration defaultTimeout;
    private final Scheduler scheduler;

    public ToolDispatcher(StructuredOutputPipeline pipeline, ObjectMapper objectMapper, Duration defaultTimeout) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.defaultTimeout = defaultTimeout == null || defaultTimeout.isZero() || defaultTimeout.isNegative()
                ? Duration.ofMinutes(2)
                : defaultTimeout;
        this.scheduler = Schedulers.newBoundedElastic(
                Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE,
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE,
                "agent-runtime-tool",
                60,
                true
        );
    }

    public Flux<StreamEvent.ToolResult> dispatch(
            List<StreamEvent.ToolCallEnd> calls,
            ToolRegistry registry,
            CancellationSignal cancellation
    ) {
        return dispatch(calls, registry, cancellation, defaultTimeout);
    }

    public Flux<StreamEvent.ToolResult> dispatch(
            List<StreamEvent.ToolCallEnd> calls,
            ToolRegistry registry,
            CancellationSignal cancellation,
            Duration timeout
    ) {
        if (calls == null || calls.isEmpty()) {
            return Flux.empty();
        }
        ToolRegistry tools = registry == null ? ToolRegistry.empty() : registry;
        CancellationSignal signal = cancellation == null ? CancellationSignal.create() : cancellation;
        Duration effectiveTimeout = timeout == null || timeout.isZero() || timeout.isNegative() ? defaultTimeout : timeout;
        return Flux.fromIterable(calls)
                .filter(Objects::nonNull)
                .flatMap(call -> dispatchOne(call, tools, signal, effectiveTimeout));
    }

    private Mono<StreamEvent.ToolResult> dispatchOne(
            StreamEvent.ToolCallEnd call,
            ToolRegistry registry,
            CancellationSignal cancellation,
            Duration timeout
    ) {
        String callId = call.callId();
        String toolName = call.toolName();
        AgentTool tool = registry.find(toolName).orElse(null);
        if (tool == null) {
            log.warn("[tool:{}] unknown tool requested, callId={}", toolName, callId);
            return Mono.just(errorResult(callId, toolName, ToolErrorKind.UNKNOWN_TOOL, "Unknown tool: " + toolName));
        }

        JsonNode arguments;
        try {
            String rawArguments = call.arguments().isBlank() ? "{}" : call.arguments();
            arguments = pipeline.parseAndValidate(rawArguments, tool.parametersSchema());
        } catch (NoObjectGeneratedException ex) {
            log.warn("[tool:{}] invalid arguments, callId={}: {}", toolName, callId, ex.getMessage());
            return Mono.just(errorResult(callId, toolName, ToolErrorKind.INVALID_ARGUMENTS, ex.getMessage()));
        }
        ToolCallRequest request = new ToolCallRequest(callId, tool.name(), arguments, call.arguments());

        Mono<StreamEvent.ToolResult> invocation = Mono.fromCallable(() -> invoke(tool, request, cancellation))
                .subscribeOn(scheduler)
                .timeout(timeout, Mono.fromSupplier(() -> {
                    log.warn("[tool:{}] timed out after {}, callId={}", toolName, timeout, callId);
                    return errorResult(callId, toolName, ToolErrorKind.TIMEOUT,
                            "Tool timeout: tool=" + toolName + ", timeoutMs=" + timeout.toMillis());
                }))
                .takeUntilOther(cancellation.whenCancelled())
                .switchIfEmpty(Mono.fromSupplier(() -> cancelledResult(callId, toolName)))
                .onErrorResume(ex -> Mono.just(failureResult(callId, toolName, ex)));

        return Mono.defer(() -> cancellation.isCancelled()
                ? Mono.just(cancelledResult(callId, toolName))
                : invocation);
    }

    private StreamEvent.ToolResult invoke(AgentTool tool, ToolCallRequest request, CancellationSignal cancellation) throws Exception {
        ToolResponse response = tool.invoke(request, cancellation);
        if (response == null) {
            return StreamEvent.ToolResult.success(request.callId(), request.name(), "");
        }
        if (response.isError()) {
            return StreamEvent.ToolResult.failure(request.callId(), request.name(), response.content(), ToolErrorKind.EXECUTION_FAILED);
        }
        return StreamEvent.ToolResult.success(request.callId(), request.name(), response.content());
    }

    private StreamEvent.ToolResult failureResult(String callId, String toolName, Throwable ex) {
        if (ex instanceof CancellationException || ex instanceof InterruptedException) {
            return cancelledResult(callId, toolName);
        }
        log.warn("[tool:{}] invocation failed, callId={}", toolName, callId, ex);
        return errorResult(callId, toolName, ToolErrorKind.EXECUTION_FAILED, resolveErrorMessage(ex));
    }

    private StreamEvent.ToolResult cancelledResult(String callId, String toolName) {
        log.debug("[tool:{}] cancelled, callId={}", toolName, callId);
        return errorResult(callId, toolName, ToolErrorKind.CANCELLED, "Tool invocation cancelled");
    }

    private StreamEvent.ToolResult errorResult(String callId, String toolName, ToolErrorKind kind, String message) {
        ObjectNode error = objectMapper.createObjectNode();
        error.put("tool", toolName);
        error.put("ok", false);
        error.put("code", kind.name().toLowerCase(Locale.ROOT));
        error.put("error", message == null ? "unknown error" : message);
        return StreamEvent.ToolResult.failure(callId, toolName == null ? "" : toolName, error.toString(), kind);
    }

    private String resolveErrorMessage(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (cursor.getMessage() != null && !cursor.getMessage().isBlank()) {
                return cursor.getMessage();
            }
            cursor = cursor.getCause();
        }
        return throwable == null ? "unknown error" : throwable.getClass().getSimpleName();
    }

    @Override
    public void close() {
        scheduler.dispose();
    }
}
