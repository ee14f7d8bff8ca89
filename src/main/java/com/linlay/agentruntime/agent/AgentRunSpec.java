package com.linlay.agentruntime.agent;

import com.linlay.agentruntime.agent.runtime.CancellationSignal;
import com.linlay.agentruntime.agent.runtime.StreamObservers;
import com.linlay.agentruntime.agent.runtime.policy.Budget;
import com.linlay.agentruntime.model.ProviderProtocol;
import com.linlay.agentruntime.tool.ToolRegistry;
import org.springframework.ai.chat.messages.Message;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of one run.
 * <p>
 * {@code maxSteps}, {@code toolTimeout} and {@code runTimeout} may be left unset; the
 * orchestrator then applies its configured {@link Budget}. A {@code null} protocol means the
 * protocol of the transport.
 */
public record AgentRunSpec(
        Integer maxSteps,
        String systemPrompt,
        List<Message> history,
        ToolRegistry tools,
        StreamObservers observers,
        CancellationSignal cancellation,
        ProviderProtocol protocol,
        String model,
        Duration toolTimeout,
        Duration runTimeout
) {

    public AgentRunSpec {
        if (maxSteps != null && maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be positive");
        }
        history = history == null
                ? List.of()
                : history.stream().filter(Objects::nonNull).toList();
        if (tools == null) {
            tools = ToolRegistry.empty();
        }
        if (observers == null) {
            observers = StreamObservers.none();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public AgentRunSpec withCancellation(CancellationSignal cancellation) {
        return new AgentRunSpec(maxSteps, systemPrompt, history, tools, observers, cancellation,
                protocol, model, toolTimeout, runTimeout);
    }

    public Budget resolveBudget(Budget defaults) {
        Budget budget = defaults == null ? Budget.DEFAULT : defaults;
        if (maxSteps != null) {
            budget = budget.withMaxSteps(maxSteps);
        }
        if (toolTimeout != null) {
            budget = budget.withToolTimeout(toolTimeout);
        }
        if (runTimeout != null) {
            budget = budget.withRunTimeout(runTimeout);
        }
        return budget;
    }

    public static final class Builder {

        private Integer maxSteps;
        private String systemPrompt;
        private List<Message> history;
        private ToolRegistry tools;
        private StreamObservers observers;
        private CancellationSignal cancellation;
        private ProviderProtocol protocol;
        private String model;
        private Duration toolTimeout;
        private Duration runTimeout;

        private Builder() {
        }

        public Builder maxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder history(List<Message> history) {
            this.history = history;
            return this;
        }

        public Builder tools(ToolRegistry tools) {
            this.tools = tools;
            return this;
        }

        public Builder observers(StreamObservers observers) {
            this.observers = observers;
            return this;
        }

        public Builder cancellation(CancellationSignal cancellation) {
            this.cancellation = cancellation;
            return this;
        }

        public Builder protocol(ProviderProtocol protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder toolTimeout(Duration toolTimeout) {
            this.toolTimeout = toolTimeout;
            return this;
        }

        public Builder runTimeout(Duration runTimeout) {
            this.runTimeout = runTimeout;
            return this;
        }

        public AgentRunSpec build() {
            return new AgentRunSpec(maxSteps, systemPrompt, history, tools, observers, cancellation,
                    protocol, model, toolTimeout, runTimeout);
        }
    }
}
