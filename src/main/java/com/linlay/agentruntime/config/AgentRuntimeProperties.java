package com.linlay.agentruntime.config;

import com.linlay.agentruntime.stream.service.ReasoningBoundaryPolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "agent.runtime")
public class AgentRuntimeProperties {

    @Min(1)
    private int maxSteps = 6;
    /**
     * Deadline for a whole run; unset means runs only end by cancellation or their own logic.
     */
    private Duration runTimeout;
    @NotNull
    private Duration toolTimeout = Duration.ofMinutes(2);
    @NotNull
    private Duration modelStreamTimeout = Duration.ofSeconds(60);
    @NotNull
    private ReasoningBoundaryPolicy reasoningBoundary = ReasoningBoundaryPolicy.INFER_FROM_CONTENT;
    /**
     * Key under {@code agent.providers} used by the reference transport.
     */
    private String provider = "default";
    private boolean logRawChunks;
    private boolean maskSensitive = true;

    public int getMaxSteps() {
        return maxSteps;
    }

    public void setMaxSteps(int maxSteps) {
        this.maxSteps = maxSteps;
    }

    public Duration getRunTimeout() {
        return runTimeout;
    }

    public void setRunTimeout(Duration runTimeout) {
        this.runTimeout = runTimeout;
    }

    public Duration getToolTimeout() {
        return toolTimeout;
    }

    public void setToolTimeout(Duration toolTimeout) {
        this.toolTimeout = toolTimeout;
    }

    public Duration getModelStreamTimeout() {
        return modelStreamTimeout;
    }

    public void setModelStreamTimeout(Duration modelStreamTimeout) {
        this.modelStreamTimeout = modelStreamTimeout;
    }

    public ReasoningBoundaryPolicy getReasoningBoundary() {
        return reasoningBoundary;
    }

    public void setReasoningBoundary(ReasoningBoundaryPolicy reasoningBoundary) {
        this.reasoningBoundary = reasoningBoundary;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public boolean isLogRawChunks() {
        return logRawChunks;
    }

    public void setLogRawChunks(boolean logRawChunks) {
        this.logRawChunks = logRawChunks;
    }

    public boolean isMaskSensitive() {
        return maskSensitive;
    }

    public void setMaskSensitive(boolean maskSensitive) {
        this.maskSensitive = maskSensitive;
    }
}
