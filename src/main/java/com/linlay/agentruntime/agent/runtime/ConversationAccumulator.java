package com.linlay.agentruntime.agent.runtime;

import com.linlay.agentruntime.stream.model.StreamEvent;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The conversation of one run: prior turns, the user prompt and every fully applied step.
 * <p>
 * Not thread-safe; only the run loop mutates it. A step is appended as a whole (assistant message,
 * then one tool response message when tools ran) or not at all.
 */
public class ConversationAccumulator {

    private final List<Message> messages = new ArrayList<>();

    public ConversationAccumulator(List<Message> history, String prompt) {
        if (history != null) {
            for (Message message : history) {
                if (message != null) {
                    messages.add(message);
                }
            }
        }
        if (prompt != null && !prompt.isBlank()) {
            messages.add(new UserMessage(prompt));
        }
    }

    /**
     * @return an immutable snapshot of the conversation so far
     */
    public List<Message> messages() {
        return List.copyOf(messages);
    }

    public int size() {
        return messages.size();
    }

    public void appendStep(String assistantText, List<StreamEvent.ToolCallEnd> toolCalls, List<StreamEvent.ToolResult> toolResults) {
        List<Message> step = new ArrayList<>(2);
        step.add(assistantMessage(assistantText, toolCalls));
        if (toolResults != null && !toolResults.isEmpty()) {
            List<ToolResponseMessage.ToolResponse> responses = new ArrayList<>(toolResults.size());
            for (StreamEvent.ToolResult result : toolResults) {
                responses.add(new ToolResponseMessage.ToolResponse(result.callId(), result.toolName(), result.output()));
            }
            step.add(new ToolResponseMessage(responses));
        }
        messages.addAll(step);
    }

    private AssistantMessage assistantMessage(String text, List<StreamEvent.ToolCallEnd> toolCalls) {
        String content = text == null ? "" : text;
        if (toolCalls == null || toolCalls.isEmpty()) {
            return new AssistantMessage(content);
        }
        List<AssistantMessage.ToolCall> calls = new ArrayList<>(toolCalls.size());
        for (StreamEvent.ToolCallEnd call : toolCalls) {
            String arguments = call.arguments().isBlank() ? "{}" : call.arguments();
            calls.add(new AssistantMessage.ToolCall(call.callId(), "function", call.toolName(), arguments));
        }
        return new AssistantMessage(content, Map.of(), calls);
    }
}
