package com.linlay.agentruntime.agent.runtime;

import com.linlay.agentruntime.agent.AgentRunResult;
import com.linlay.agentruntime.agent.AgentStep;
import com.linlay.agentruntime.stream.model.StreamEvent;
import com.linlay.agentruntime.stream.model.StreamEventKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Callbacks a caller registers for one run: per-kind event observers plus run lifecycle hooks.
 * <p>
 * Event observers are called on the run thread, in arrival order, and may end delivery for the
 * current step by returning {@link ObserverSignal#STOP}. An exception thrown by an event observer
 * is fatal for the run. Lifecycle hooks cannot influence the run; their failures are logged.
 */
public final class StreamObservers {

    private static final Logger log = LoggerFactory.getLogger(StreamObservers.class);
    private static final StreamObservers NONE = builder().build();

    private final Map<StreamEventKind, List<EventObserver>> eventObservers;
    private final List<Runnable> runStartHooks;
    private final List<IntConsumer> stepStartHooks;
    private final List<Consumer<AgentStep>> stepFinishHooks;
    private final List<Consumer<AgentRunResult>> runFinishHooks;
    private final List<Consumer<Throwable>> errorHooks;

    private StreamObservers(Builder builder) {
        Map<StreamEventKind, List<EventObserver>> observers = new EnumMap<>(StreamEventKind.class);
        builder.eventObservers.forEach((kind, list) -> observers.put(kind, List.copyOf(list)));
        this.eventObservers = observers;
        this.runStartHooks = List.copyOf(builder.runStartHooks);
        this.stepStartHooks = List.copyOf(builder.stepStartHooks);
        this.stepFinishHooks = List.copyOf(builder.stepFinishHooks);
        this.runFinishHooks = List.copyOf(builder.runFinishHooks);
        this.errorHooks = List.copyOf(builder.errorHooks);
    }

    public static StreamObservers none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Hands the event to every observer registered for its kind, in registration order.
     *
     * @return {@link ObserverSignal#STOP} if at least one observer asked to stop
     */
    public ObserverSignal deliver(StreamEvent event) {
        List<EventObserver> observers = eventObservers.get(event.kind());
        if (observers == null) {
            return ObserverSignal.CONTINUE;
        }
        ObserverSignal result = ObserverSignal.CONTINUE;
        for (EventObserver observer : observers) {
            if (observer.onEvent(event) == ObserverSignal.STOP) {
                result = ObserverSignal.STOP;
            }
        }
        return result;
    }

    public void runStarted() {
        runStartHooks.forEach(hook -> safely("onRunStart", hook));
    }

    public void stepStarted(int stepNumber) {
        stepStartHooks.forEach(hook -> safely("onStepStart", () -> hook.accept(stepNumber)));
    }

    public void stepFinished(AgentStep step) {
        stepFinishHooks.forEach(hook -> safely("onStepFinish", () -> hook.accept(step)));
    }

    public void runFinished(AgentRunResult result) {
        runFinishHooks.forEach(hook -> safely("onRunFinish", () -> hook.accept(result)));
    }

    public void errorOccurred(Throwable error) {
        errorHooks.forEach(hook -> safely("onError", () -> hook.accept(error)));
    }

    private void safely(String hookName, Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException ex) {
            log.warn("{} hook failed", hookName, ex);
        }
    }

    @FunctionalInterface
    public interface EventObserver {
        ObserverSignal onEvent(StreamEvent event);
    }

    public static final class Builder {

        private final Map<StreamEventKind, List<EventObserver>> eventObservers = new EnumMap<>(StreamEventKind.class);
        private final List<Runnable> runStartHooks = new ArrayList<>();
        private final List<IntConsumer> stepStartHooks = new ArrayList<>();
        private final List<Consumer<AgentStep>> stepFinishHooks = new ArrayList<>();
        private final List<Consumer<AgentRunResult>> runFinishHooks = new ArrayList<>();
        private final List<Consumer<Throwable>> errorHooks = new ArrayList<>();

        private Builder() {
        }

        public Builder on(StreamEventKind kind, EventObserver observer) {
            Objects.requireNonNull(kind, "kind cannot be null");
            Objects.requireNonNull(observer, "observer cannot be null");
            eventObservers.computeIfAbsent(kind, ignored -> new ArrayList<>()).add(observer);
            return this;
        }

        /**
         * Registers {@code observer} for every event kind.
         */
        public Builder onEvent(EventObserver observer) {
            for (StreamEventKind kind : StreamEventKind.values()) {
                on(kind, observer);
            }
            return this;
        }

        public Builder onTextDelta(Function<StreamEvent.TextDelta, ObserverSignal> observer) {
            return on(StreamEventKind.TEXT_DELTA, event -> observer.apply((StreamEvent.TextDelta) event));
        }

        public Builder onReasoningDelta(Function<StreamEvent.ReasoningDelta, ObserverSignal> observer) {
            return on(StreamEventKind.REASONING_DELTA, event -> observer.apply((StreamEvent.ReasoningDelta) event));
        }

        public Builder onToolCallEnd(Function<StreamEvent.ToolCallEnd, ObserverSignal> observer) {
            return on(StreamEventKind.TOOL_CALL_END, event -> observer.apply((StreamEvent.ToolCallEnd) event));
        }

        public Builder onToolResult(Function<StreamEvent.ToolResult, ObserverSignal> observer) {
            return on(StreamEventKind.TOOL_RESULT, event -> observer.apply((StreamEvent.ToolResult) event));
        }

        public Builder onStepFinishEvent(Function<StreamEvent.StepFinish, ObserverSignal> observer) {
            return on(StreamEventKind.STEP_FINISH, event -> observer.apply((StreamEvent.StepFinish) event));
        }

        public Builder onRunStart(Runnable hook) {
            runStartHooks.add(Objects.requireNonNull(hook, "hook cannot be null"));
            return this;
        }

        public Builder onStepStart(IntConsumer hook) {
            stepStartHooks.add(Objects.requireNonNull(hook, "hook cannot be null"));
            return this;
        }

        public Builder onStepFinish(Consumer<AgentStep> hook) {
            stepFinishHooks.add(Objects.requireNonNull(hook, "hook cannot be null"));
            return this;
        }

        public Builder onRunFinish(Consumer<AgentRunResult> hook) {
            runFinishHooks.add(Objects.requireNonNull(hook, "hook cannot be null"));
            return this;
        }

        public Builder onError(Consumer<Throwable> hook) {
            errorHooks.add(Objects.requireNonNull(hook, "hook cannot be null"));
            return this;
        }

        public StreamObservers build() {
            return new StreamObservers(this);
        }
    }
}
