package com.linlay.agentruntime.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentruntime.agent.AgentOrchestrator;
import com.linlay.agentruntime.agent.ObjectGenerator;
import com.linlay.agentruntime.agent.runtime.policy.Budget;
import com.linlay.agentruntime.json.JsonRecoveryEngine;
import com.linlay.agentruntime.json.SchemaValidator;
import com.linlay.agentruntime.json.StructuredOutputPipeline;
import com.linlay.agentruntime.service.ModelTransport;
import com.linlay.agentruntime.service.OpenAiCompatibleSseTransport;
import com.linlay.agentruntime.stream.service.StreamNormalizerFactory;
import com.linlay.agentruntime.tool.ToolDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties({AgentRuntimeProperties.class, AgentProviderProperties.class})
public class AgentRuntimeConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AgentRuntimeConfiguration.class);

    @Bean
    public JsonRecoveryEngine jsonRecoveryEngine(ObjectMapper objectMapper) {
        return new JsonRecoveryEngine(objectMapper);
    }

    @Bean
    public SchemaValidator schemaValidator(ObjectMapper objectMapper) {
        return new SchemaValidator(objectMapper);
    }

    @Bean
    public StructuredOutputPipeline structuredOutputPipeline(JsonRecoveryEngine jsonRecoveryEngine, SchemaValidator schemaValidator) {
        return new StructuredOutputPipeline(jsonRecoveryEngine, schemaValidator);
    }

    @Bean
    public StreamNormalizerFactory streamNormalizerFactory(ObjectMapper objectMapper, AgentRuntimeProperties properties) {
        return new StreamNormalizerFactory(objectMapper, properties.getReasoningBoundary());
    }

    @Bean(destroyMethod = "close")
    public ToolDispatcher toolDispatcher(
            StructuredOutputPipeline structuredOutputPipeline,
            ObjectMapper objectMapper,
            AgentRuntimeProperties properties
    ) {
        return new ToolDispatcher(structuredOutputPipeline, objectMapper, properties.getToolTimeout());
    }

    @Bean(destroyMethod = "dispose")
    public ConnectionProvider llmConnectionProvider() {
        return ConnectionProvider.builder("llm-pool")
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(ModelTransport.class)
    public ModelTransport modelTransport(
            AgentRuntimeProperties properties,
            AgentProviderProperties providerProperties,
            ConnectionProvider llmConnectionProvider
    ) {
        String providerKey = properties.getProvider();
        log.info("Using OpenAI compatible transport for provider '{}'", providerKey);
        return new OpenAiCompatibleSseTransport(
                providerKey,
                providerProperties.getProvider(providerKey),
                properties.getModelStreamTimeout(),
                properties.isLogRawChunks(),
                properties.isMaskSensitive(),
                llmConnectionProvider
        );
    }

    @Bean
    public AgentOrchestrator agentOrchestrator(
            ModelTransport modelTransport,
            StreamNormalizerFactory streamNormalizerFactory,
            ToolDispatcher toolDispatcher,
            AgentRuntimeProperties properties
    ) {
        Budget budget = new Budget(properties.getMaxSteps(), properties.getRunTimeout(), properties.getToolTimeout());
        return new AgentOrchestrator(modelTransport, streamNormalizerFactory, toolDispatcher, budget);
    }

    @Bean
    public ObjectGenerator objectGenerator(
            ModelTransport modelTransport,
            StreamNormalizerFactory streamNormalizerFactory,
            StructuredOutputPipeline structuredOutputPipeline
    ) {
        return new ObjectGenerator(modelTransport, streamNormalizerFactory, structuredOutputPipeline);
    }
}
