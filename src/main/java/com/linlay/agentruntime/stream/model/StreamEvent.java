package com.linlay.agentruntime.stream.model;

/**
 * Canonical, vendor independent unit of streamed model output.
 * <p>
 * Every event except {@link Error} and {@link Finish} carries a content-block id. For one id,
 * the start event precedes all deltas, which precede the end event. Events of different blocks
 * may interleave.
 */
public sealed interface StreamEvent permits
        StreamEvent.TextDelta,
        StreamEvent.ReasoningStart,
        StreamEvent.ReasoningDelta,
        StreamEvent.ReasoningEnd,
        StreamEvent.ToolCallStart,
        StreamEvent.ToolCallDelta,
        StreamEvent.ToolCallEnd,
        StreamEvent.ToolResult,
        StreamEvent.StepFinish,
        StreamEvent.Error,
        StreamEvent.Finish {

    StreamEventKind kind();

    /**
     * Content-block id, or {@code null} for {@link Error} and {@link Finish}.
     */
    String blockId();

    record TextDelta(String blockId, String delta) implements StreamEvent {
        public TextDelta {
            requireNonBlank(blockId, "blockId");
            requireNonNull(delta, "delta");
        }

        @Override
        public StreamEventKind kind() {
            return StreamEventKind.TEXT_DELTA;
        }
    }

    record ReasoningStart(String blockId) implements StreamEvent {
        public ReasoningStart {
            requireNonBlank(blockId, "blockId");
        }

        @Override
        public StreamEventKind kind() {
            return StreamEventKind.REASONING_START;
        }
    }

    record ReasoningDelta(String blockId, String delta) implements StreamEvent {
        public ReasoningDelta {
            requireNonBlank(blockId, "blockId");
            requireNonNull(delta, "delta");
        }

        @Override
        public StreamEventKind kind() {
            return StreamEventKind.REASONING_DELTA;
        }
    }

    record ReasoningEnd(String blockId) implements StreamEvent {
        public ReasoningEnd {
            requireNonBlank(blockId, "blockId");
        }

        @Override
        public StreamEventKind kind() {
            return StreamEventKind.REASONING_END;
        }
    }

    record ToolCallStart(String blockId, String toolName) implements StreamEvent {
        public ToolCallStart {
            requireNonBlank(blockId, "blockId");
        }

        @Override
        public StreamEventKind kind() {
            return StreamEventKind.TOOL_CALL_START;
        }
    }

    record ToolCallDelta(String blockId, String delta) implements StreamEvent {
        public ToolCallDelta {
            requireNonBlank(blockId, "blockId");
            requireNonNull(delta, "delta");
        }

        @Override
        public StreamEventKind kind() {
            return StreamEventKind.TOOL_CALL_DELTA;
        }
    }

    /**
     * A completed tool call. {@code arguments} is the concatenation of every delta of the block.
     */
    record ToolCallEnd(String blockId, String toolName, String arguments) implements StreamEvent {
        public ToolCallEnd {
            requireNonBlank(blockId, "blockId");
            if (arguments == null) {
                arguments = "";
            }
        }

        public String callId() {
            return blockId;
        }

        @Override
        public StreamEventKind kind() {
            return StreamEventKind.TOOL_CALL_END;
        }
    }

    record ToolResult(
            String callId,
            String toolName,
            String output,
            boolean isError,
            ToolErrorKind errorKind
    ) implements StreamEvent {
        public ToolResult {
            requireNonBlank(callId, "callId");
            requireNonNull(output, "output");
            if (errorKind == null) {
                errorKind = isError ? ToolErrorKind.EXECUTION_FAILED : ToolErrorKind.NONE;
            }
            if (isError == (errorKind == ToolErrorKind.NONE)) {
                throw new IllegalArgumentException("isError must match errorKind " + errorKind);
            }
        }

        public static ToolResult success(String callId, String toolName, String output) {
            return new ToolResult(callId, toolName, output, false, ToolErrorKind.NONE);
        }

        public static ToolResult failure(String callId, String toolName, String output, ToolErrorKind errorKind) {
            return new ToolResult(callId, toolName, output, true, errorKind);
        }

        @Override
        public String blockId() {
            return callId;
        }

        @Override
        public StreamEventKind kind() {
            return StreamEventKind.TOOL_RESULT;
        }
    }

    record StepFinish(int stepNumber, FinishReason finishReason, Usage usage) implements StreamEvent {
        public StepFinish {
            if (stepNumber < 1) {
                throw new IllegalArgumentException("stepNumber must be positive");
            }
            requireNonNull(finishReason, "finishReason");
            if (usage == null) {
                usage = Usage.EMPTY;
            }
        }

        @Override
        public String blockId() {
            return "step-" + stepNumber;
        }

        @Override
        public StreamEventKind kind() {
            return StreamEventKind.STEP_FINISH;
        }
    }

    record Error(Throwable cause) implements StreamEvent {
        public Error {
            requireNonNull(cause, "cause");
        }

        @Override
        public String blockId() {
            return null;
        }

        @Override
        public StreamEventKind kind() {
            return StreamEventKind.ERROR;
        }
    }

    record Finish(FinishReason finishReason, Usage usage) implements StreamEvent {
        public Finish {
            if (finishReason == null) {
                finishReason = FinishReason.UNKNOWN;
            }
            if (usage == null) {
                usage = Usage.EMPTY;
            }
        }

        @Override
        public String blockId() {
            return null;
        }

        @Override
        public StreamEventKind kind() {
            return StreamEventKind.FINISH;
        }
    }

    private static void requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be null or blank");
        }
    }

    private static void requireNonNull(Object value, String fieldName) {
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " must not be null");
        }
    }
}
