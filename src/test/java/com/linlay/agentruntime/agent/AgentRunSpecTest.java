package com.linlay.agentruntime.agent;

import com.linlay.agentruntime.agent.runtime.StreamObservers;
import com.linlay.agentruntime.agent.runtime.policy.Budget;
import com.linlay.agentruntime.tool.ToolRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentRunSpecTest {

    @Test
    void shouldFillDefaults() {
        AgentRunSpec spec = AgentRunSpec.builder().build();

        assertThat(spec.tools()).isSameAs(ToolRegistry.empty());
        assertThat(spec.observers()).isSameAs(StreamObservers.none());
        assertThat(spec.history()).isEmpty();
        assertThat(spec.resolveBudget(null)).isEqualTo(Budget.DEFAULT);
        assertThat(Budget.DEFAULT.maxSteps()).isEqualTo(6);
    }

    @Test
    void explicitLimitsShouldOverrideConfiguredBudget() {
        Budget configured = new Budget(10, Duration.ofMinutes(5), Duration.ofSeconds(30));
        AgentRunSpec spec = AgentRunSpec.builder()
                .maxSteps(2)
                .toolTimeout(Duration.ofSeconds(3))
                .build();

        Budget budget = spec.resolveBudget(configured);

        assertThat(budget).isEqualTo(new Budget(2, Duration.ofMinutes(5), Duration.ofSeconds(3)));
    }

    @Test
    void budgetShouldNormalizeNonPositiveValues() {
        Budget budget = new Budget(0, Duration.ZERO, Duration.ofSeconds(-1));

        assertThat(budget).isEqualTo(Budget.DEFAULT);
    }

    @Test
    void shouldRejectNonPositiveStepLimit() {
        assertThatThrownBy(() -> AgentRunSpec.builder().maxSteps(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
