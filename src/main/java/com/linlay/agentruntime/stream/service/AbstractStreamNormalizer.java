package com.linlay.agentruntime.stream.service;

import com.linlay.agentruntime.stream.model.FinishReason;
import com.linlay.agentruntime.stream.model.StreamEvent;
import com.linlay.agentruntime.stream.model.Usage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Shared terminal-state handling for vendor adapters. Subclasses translate one chunk in
 * {@link #consume(String, List)} and throw on anything they cannot accept; the failure becomes
 * the single {@link StreamEvent.Error} of the response.
 */
public abstract class AbstractStreamNormalizer implements StreamNormalizer {

    private static final Logger log = LoggerFactory.getLogger(AbstractStreamNormalizer.class);

    protected final ContentBlockTable blocks = new ContentBlockTable();

    // reasoning blocks opened in the table whose start event waits for the first text
    private final Set<String> unannouncedReasoning = new HashSet<>();

    private boolean terminated;
    private boolean finishEmitted;
    private FinishReason finishReason;
    private Usage usage = Usage.EMPTY;

    @Override
    public final List<StreamEvent> normalize(String rawChunk) {
        if (terminated) {
            return List.of();
        }
        List<StreamEvent> events = new ArrayList<>();
        try {
            consume(rawChunk, events);
        } catch (RuntimeException ex) {
            events.add(fail(ex));
        }
        return events;
    }

    @Override
    public final List<StreamEvent> complete() {
        if (terminated) {
            return List.of();
        }
        List<StreamEvent> events = new ArrayList<>();
        try {
            closeOpenBlocks(events);
            emitFinish(events);
            terminated = true;
        } catch (RuntimeException ex) {
            events.add(fail(ex));
        }
        return events;
    }

    @Override
    public final boolean terminated() {
        return terminated;
    }

    protected abstract void consume(String rawChunk, List<StreamEvent> events);

    protected final void openReasoning(String id, List<StreamEvent> events) {
        blocks.open(id, ContentBlockTable.BlockKind.REASONING, null);
        events.add(new StreamEvent.ReasoningStart(id));
    }

    /**
     * Opens a reasoning block whose start event is only emitted with its first non-empty delta.
     * A block that is closed without any text produces no events at all.
     */
    protected final void openReasoningLazily(String id) {
        blocks.open(id, ContentBlockTable.BlockKind.REASONING, null);
        unannouncedReasoning.add(id);
    }

    protected final void openToolCall(String id, String toolName, List<StreamEvent> events) {
        blocks.open(id, ContentBlockTable.BlockKind.TOOL_CALL, toolName);
        events.add(new StreamEvent.ToolCallStart(id, toolName));
    }

    /**
     * Text blocks have no start or end event of their own, only deltas.
     */
    protected final void openText(String id) {
        blocks.open(id, ContentBlockTable.BlockKind.TEXT, null);
    }

    protected final void appendText(String id, String delta, List<StreamEvent> events) {
        blocks.append(id, ContentBlockTable.BlockKind.TEXT, delta);
        events.add(new StreamEvent.TextDelta(id, delta));
    }

    protected final void appendReasoning(String id, String delta, List<StreamEvent> events) {
        blocks.append(id, ContentBlockTable.BlockKind.REASONING, delta);
        if (!hasText(delta)) {
            return;
        }
        if (unannouncedReasoning.remove(id)) {
            events.add(new StreamEvent.ReasoningStart(id));
        }
        events.add(new StreamEvent.ReasoningDelta(id, delta));
    }

    protected final void appendToolArguments(String id, String delta, List<StreamEvent> events) {
        blocks.append(id, ContentBlockTable.BlockKind.TOOL_CALL, delta);
        events.add(new StreamEvent.ToolCallDelta(id, delta));
    }

    protected final void closeBlock(String id, List<StreamEvent> events) {
        ContentBlockTable.Block block = blocks.close(id);
        switch (block.kind()) {
            case REASONING -> {
                if (!unannouncedReasoning.remove(id)) {
                    events.add(new StreamEvent.ReasoningEnd(id));
                }
            }
            case TOOL_CALL -> events.add(new StreamEvent.ToolCallEnd(id, block.toolName(), block.arguments()));
            case TEXT -> {
                // no closing event for text
            }
        }
    }

    protected final void closeOpenBlocks(List<StreamEvent> events) {
        for (String id : blocks.openBlockIds()) {
            closeBlock(id, events);
        }
    }

    protected final void recordFinishReason(FinishReason reason) {
        if (reason != null) {
            finishReason = reason;
        }
    }

    protected final boolean finishReasonSeen() {
        return finishReason != null;
    }

    protected final void recordUsage(Usage update) {
        usage = usage.merge(update);
    }

    protected final void emitFinish(List<StreamEvent> events) {
        if (finishEmitted) {
            return;
        }
        finishEmitted = true;
        events.add(new StreamEvent.Finish(finishReason == null ? FinishReason.UNKNOWN : finishReason, usage));
    }

    protected static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    private StreamEvent fail(RuntimeException ex) {
        terminated = true;
        StreamProtocolException error = ex instanceof StreamProtocolException protocol
                ? protocol
                : new StreamProtocolException(ex.getMessage(), ex);
        log.warn("[{}] stream normalization stopped: {}", getClass().getSimpleName(), error.getMessage());
        return new StreamEvent.Error(error);
    }
}
