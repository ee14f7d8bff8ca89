package com.linlay.agentruntime.service;

import com.linlay.agentruntime.agent.runtime.CancellationSignal;
import com.linlay.agentruntime.config.AgentProviderProperties;
import com.linlay.agentruntime.model.ProviderProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reference transport for OpenAI compatible chat-completions endpoints. Posts a streaming
 * request with WebClient and emits the SSE data payloads untouched.
 */
public class OpenAiCompatibleSseTransport implements ModelTransport {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleSseTransport.class);
    private static final Duration DEFAULT_STREAM_TIMEOUT = Duration.ofSeconds(60);

    private final String providerKey;
    private final AgentProviderProperties.ProviderConfig config;
    private final Duration streamTimeout;
    private final boolean logRawChunks;
    private final boolean maskSensitive;
    private final WebClient webClient;

    public OpenAiCompatibleSseTransport(
            String providerKey,
            AgentProviderProperties.ProviderConfig config,
            Duration streamTimeout,
            boolean logRawChunks,
            boolean maskSensitive,
            ConnectionProvider connectionProvider
    ) {
        this.providerKey = providerKey;
        this.config = validate(providerKey, config);
        this.streamTimeout = streamTimeout == null || streamTimeout.isZero() || streamTimeout.isNegative()
                ? DEFAULT_STREAM_TIMEOUT
                : streamTimeout;
        this.logRawChunks = logRawChunks;
        this.maskSensitive = maskSensitive;
        this.webClient = buildWebClient(this.config, connectionProvider);
    }

    @Override
    public Flux<String> issueModelCall(ModelRequest request, CancellationSignal cancellation) {
        Objects.requireNonNull(request, "request cannot be null");
        CancellationSignal signal = cancellation == null ? CancellationSignal.create() : cancellation;
        return Flux.defer(() -> {
            Map<String, Object> body = buildRequestBody(request);
            AtomicBoolean firstChunkReceived = new AtomicBoolean(false);
            AtomicInteger chunkIndex = new AtomicInteger(0);
            long startNanos = System.nanoTime();

            log.info("[provider:{}] model call start model={}, messages={}, tools={}",
                    providerKey, body.get("model"), request.messages().size(), request.tools().size());

            return webClient.post()
                    .uri(resolveCompletionsUri(config.getBaseUrl()))
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToFlux(String.class)
                    .doOnNext(chunk -> firstChunkReceived.set(true))
                    .retryWhen(Retry.max(1)
                            .filter(ex -> !firstChunkReceived.get() && isConnectionError(ex))
                            .onRetryExhaustedThrow((spec, signalState) -> signalState.failure()))
                    .doOnNext(chunk -> {
                        int index = chunkIndex.getAndIncrement();
                        if (logRawChunks) {
                            log.debug("[provider:{}][raw-chunk:{}] {}", providerKey, index,
                                    LlmLogSanitizer.abbreviate(LlmLogSanitizer.maskText(chunk, maskSensitive)));
                        }
                    })
                    .timeout(streamTimeout)
                    .takeUntilOther(signal.whenCancelled())
                    .onErrorMap(ex -> !(ex instanceof ModelCallException), this::toModelCallException)
                    .doOnComplete(() -> log.info("[provider:{}] model call finished in {} ms, chunks={}",
                            providerKey, elapsedMs(startNanos), chunkIndex.get()))
                    .doOnCancel(() -> log.info("[provider:{}] model call cancelled in {} ms, chunks={}",
                            providerKey, elapsedMs(startNanos), chunkIndex.get()));
        });
    }

    @Override
    public ProviderProtocol protocol() {
        return ProviderProtocol.OPENAI;
    }

    Map<String, Object> buildRequestBody(ModelRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", StringUtils.hasText(request.model()) ? request.model() : config.getModel());
        body.put("stream", true);
        body.put("stream_options", Map.of("include_usage", true));
        body.put("messages", buildRawMessages(request.systemPrompt(), request.messages()));

        List<Map<String, Object>> rawTools = buildRawTools(request.tools());
        if (!rawTools.isEmpty()) {
            body.put("tools", rawTools);
            body.put("tool_choice", "auto");
            body.put("parallel_tool_calls", true);
        }
        if (request.responseSchema() != null && !request.responseSchema().isEmpty()) {
            body.put("response_format", Map.of(
                    "type", "json_schema",
                    "json_schema", Map.of(
                            "name", "response_schema",
                            "schema", request.responseSchema(),
                            "strict", true
                    )
            ));
        }
        return body;
    }

    private ModelCallException toModelCallException(Throwable ex) {
        if (ex instanceof TimeoutException) {
            return new ModelCallException("model stream timed out after " + streamTimeout.toMillis() + " ms", ex);
        }
        String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        return new ModelCallException("model call to provider '" + providerKey + "' failed: " + message, ex);
    }

    private static AgentProviderProperties.ProviderConfig validate(String providerKey, AgentProviderProperties.ProviderConfig config) {
        if (config == null) {
            throw new IllegalStateException("No provider config found for key: " + providerKey);
        }
        ProviderProtocol protocol = config.getProtocol() == null ? ProviderProtocol.OPENAI : config.getProtocol();
        if (protocol != ProviderProtocol.OPENAI) {
            throw new IllegalStateException("Unsupported protocol for key '%s': %s".formatted(providerKey, protocol));
        }
        if (!StringUtils.hasText(config.getBaseUrl())) {
            throw new IllegalStateException("Missing base-url for key: " + providerKey);
        }
        if (!StringUtils.hasText(config.getApiKey())) {
            throw new IllegalStateException("Missing api-key for key: " + providerKey);
        }
        return config;
    }

    private static WebClient buildWebClient(AgentProviderProperties.ProviderConfig config, ConnectionProvider connectionProvider) {
        HttpClient httpClient = connectionProvider != null
                ? HttpClient.create(connectionProvider)
                : HttpClient.create();
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    private static String resolveCompletionsUri(String baseUrl) {
        String normalized = baseUrl == null ? "" : baseUrl.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("/v1") || normalized.endsWith("/v1/")) {
            return "/chat/completions";
        }
        return "/v1/chat/completions";
    }

    private List<Map<String, Object>> buildRawMessages(String systemPrompt, List<Message> conversation) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(rawTextMessage("system", systemPrompt));
        }
        for (Message message : conversation) {
            messages.addAll(toRawMessages(message));
        }
        return messages;
    }

    private List<Map<String, Object>> toRawMessages(Message message) {
        if (message == null) {
            return List.of();
        }
        if (message instanceof SystemMessage systemMessage) {
            return List.of(rawTextMessage("system", systemMessage.getText()));
        }
        if (message instanceof UserMessage userMessage) {
            return List.of(rawTextMessage("user", userMessage.getText()));
        }
        if (message instanceof AssistantMessage assistantMessage) {
            Map<String, Object> assistant = new LinkedHashMap<>();
            assistant.put("role", "assistant");
            String content = assistantMessage.getText();
            assistant.put("content", content == null ? "" : content);
            if (assistantMessage.getToolCalls() != null && !assistantMessage.getToolCalls().isEmpty()) {
                List<Map<String, Object>> toolCalls = new ArrayList<>();
                for (AssistantMessage.ToolCall call : assistantMessage.getToolCalls()) {
                    Map<String, Object> function = new LinkedHashMap<>();
                    function.put("name", call.name());
                    function.put("arguments", call.arguments());
                    Map<String, Object> toolCall = new LinkedHashMap<>();
                    toolCall.put("id", call.id());
                    toolCall.put("type", call.type() == null ? "function" : call.type());
                    toolCall.put("function", function);
                    toolCalls.add(toolCall);
                }
                assistant.put("tool_calls", toolCalls);
            }
            return List.of(assistant);
        }
        if (message instanceof ToolResponseMessage toolResponseMessage) {
            List<Map<String, Object>> toolMessages = new ArrayList<>();
            for (ToolResponseMessage.ToolResponse response : toolResponseMessage.getResponses()) {
                Map<String, Object> tool = new LinkedHashMap<>();
                tool.put("role", "tool");
                tool.put("tool_call_id", response.id());
                tool.put("name", response.name());
                tool.put("content", response.responseData());
                toolMessages.add(tool);
            }
            return toolMessages;
        }
        String role = message.getMessageType() == null
                ? "assistant"
                : message.getMessageType().name().toLowerCase(Locale.ROOT);
        return List.of(rawTextMessage(role, message.getText()));
    }

    private Map<String, Object> rawTextMessage(String role, String content) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("role", role);
        message.put("content", content == null ? "" : content);
        return message;
    }

    private List<Map<String, Object>> buildRawTools(List<ModelRequest.FunctionTool> tools) {
        List<Map<String, Object>> rawTools = new ArrayList<>();
        for (ModelRequest.FunctionTool tool : tools) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", tool.name());
            if (!tool.description().isBlank()) {
                function.put("description", tool.description());
            }
            function.put("parameters", tool.parameters() == null
                    ? Map.of("type", "object", "properties", Map.of(), "additionalProperties", true)
                    : tool.parameters());
            Map<String, Object> toolMap = new LinkedHashMap<>();
            toolMap.put("type", "function");
            toolMap.put("function", function);
            rawTools.add(toolMap);
        }
        return rawTools;
    }

    private long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private boolean isConnectionError(Throwable ex) {
        if (ex instanceof IOException) {
            return true;
        }
        Throwable cause = ex.getCause();
        return cause instanceof IOException;
    }
}
