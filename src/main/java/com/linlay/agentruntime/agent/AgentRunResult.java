package com.linlay.agentruntime.agent;

import com.linlay.agentruntime.stream.model.Usage;
import org.springframework.ai.chat.messages.Message;

import java.util.List;
import java.util.Objects;

/**
 * Final state of a run.
 *
 * @param conversation prior turns, the prompt and every fully applied step
 * @param error        first fatal error, {@code null} unless {@code terminalReason} is {@link RunTerminalReason#ERRORED}
 * @param usage        token usage summed over all steps
 */
public record AgentRunResult(
        String runId,
        List<AgentStep> steps,
        List<Message> conversation,
        RunTerminalReason terminalReason,
        Throwable error,
        Usage usage
) {

    public AgentRunResult {
        steps = steps == null ? List.of() : List.copyOf(steps);
        conversation = conversation == null ? List.of() : List.copyOf(conversation);
        Objects.requireNonNull(terminalReason, "terminalReason cannot be null");
        usage = usage == null ? Usage.EMPTY : usage;
    }

    /**
     * Assistant text of the last step, or an empty string when the run made no model call.
     */
    public String finalText() {
        return steps.isEmpty() ? "" : steps.get(steps.size() - 1).text();
    }

    public RunOutcome outcome() {
        return new RunOutcome(terminalReason, error);
    }
}
