package com.linlay.agentruntime.agent;

import com.linlay.agentruntime.agent.runtime.AgentRunState;
import com.linlay.agentruntime.agent.runtime.CancellationSignal;
import com.linlay.agentruntime.agent.runtime.ConversationAccumulator;
import com.linlay.agentruntime.agent.runtime.ObserverSignal;
import com.linlay.agentruntime.agent.runtime.StreamObservers;
import com.linlay.agentruntime.agent.runtime.policy.Budget;
import com.linlay.agentruntime.model.ProviderProtocol;
import com.linlay.agentruntime.service.ModelCallException;
import com.linlay.agentruntime.service.ModelRequest;
import com.linlay.agentruntime.service.ModelTransport;
import com.linlay.agentruntime.stream.model.FinishReason;
import com.linlay.agentruntime.stream.model.StreamEvent;
import com.linlay.agentruntime.stream.model.Usage;
import com.linlay.agentruntime.stream.service.StreamNormalizer;
import com.linlay.agentruntime.stream.service.StreamNormalizerFactory;
import com.linlay.agentruntime.tool.ToolDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Drives a run: one model call per step, canonical events to the observers, the step's completed
 * tool calls to the dispatcher, and the continuation decision.
 * <p>
 * The orchestrator itself is stateless; every call of {@link #run}, {@link #stream} or
 * {@link #events} owns its own conversation and steps. The loop runs on the calling thread and
 * blocks on the model stream and on tool dispatch.
 */
public class AgentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

    private final ModelTransport transport;
    private final StreamNormalizerFactory normalizerFactory;
    private final ToolDispatcher toolDispatcher;
    private final Budget defaultBudget;

    public AgentOrchestrator(
            ModelTransport transport,
            StreamNormalizerFactory normalizerFactory,
            ToolDispatcher toolDispatcher,
            Budget defaultBudget
    ) {
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.normalizerFactory = Objects.requireNonNull(normalizerFactory, "normalizerFactory cannot be null");
        this.toolDispatcher = Objects.requireNonNull(toolDispatcher, "toolDispatcher cannot be null");
        this.defaultBudget = defaultBudget == null ? Budget.DEFAULT : defaultBudget;
    }

    public AgentRunResult run(AgentRunSpec spec, String prompt) {
        return execute(spec, prompt, event -> {
        });
    }

    /**
     * Same as {@link #run} for callers that consume everything through observers.
     */
    public RunOutcome stream(AgentRunSpec spec, String prompt) {
        return run(spec, prompt).outcome();
    }

    /**
     * Runs on a bounded-elastic worker and pushes every canonical event of the run. The flux
     * completes when the run ends, or signals the run's fatal error when it ends
     * {@link RunTerminalReason#ERRORED}. Cancelling the subscription cancels the run.
     */
    public Flux<StreamEvent> events(AgentRunSpec spec, String prompt) {
        Objects.requireNonNull(spec, "spec cannot be null");
        return Flux.create(sink -> {
            CancellationSignal cancellation = spec.cancellation() == null
                    ? CancellationSignal.create()
                    : spec.cancellation();
            AgentRunSpec effective = spec.withCancellation(cancellation);
            sink.onCancel(cancellation::cancel);
            Schedulers.boundedElastic().schedule(() -> {
                try {
                    AgentRunResult result = execute(effective, prompt, sink::next);
                    if (result.terminalReason() == RunTerminalReason.ERRORED && result.error() != null) {
                        sink.error(result.error());
                    } else {
                        sink.complete();
                    }
                } catch (RuntimeException ex) {
                    sink.error(ex);
                }
            });
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    private AgentRunResult execute(AgentRunSpec spec, String prompt, Consumer<StreamEvent> eventSink) {
        Objects.requireNonNull(spec, "spec cannot be null");
        Budget budget = spec.resolveBudget(defaultBudget);
        CancellationSignal cancellation;
        Disposable deadlineLink = null;
        if (spec.cancellation() == null) {
            cancellation = CancellationSignal.withTimeout(budget.runTimeout());
        } else if (budget.runTimeout() == null) {
            cancellation = spec.cancellation();
        } else {
            CancellationSignal linked = CancellationSignal.withTimeout(budget.runTimeout());
            deadlineLink = spec.cancellation().onCancel(linked::cancel);
            cancellation = linked;
        }

        RunContext run = new RunContext(spec, budget, cancellation, new ConversationAccumulator(spec.history(), prompt), eventSink);
        StreamObservers observers = spec.observers();
        log.info("[run:{}] start maxSteps={}, tools={}, history={}",
                run.runId, budget.maxSteps(), spec.tools().size(), spec.history().size());
        observers.runStarted();

        RunTerminalReason reason;
        try {
            reason = loop(run);
        } catch (RuntimeException ex) {
            log.warn("[run:{}][step:{}] run failed", run.runId, run.stepNumber, ex);
            run.transition(AgentRunState.ERRORED);
            run.error = ex;
            reason = RunTerminalReason.ERRORED;
        } finally {
            if (deadlineLink != null) {
                deadlineLink.dispose();
            }
        }

        if (run.error != null) {
            observers.errorOccurred(run.error);
        }
        AgentRunResult result = new AgentRunResult(
                run.runId,
                run.steps,
                run.conversation.messages(),
                reason,
                reason == RunTerminalReason.ERRORED ? run.error : null,
                run.usage
        );
        log.info("[run:{}] finished reason={}, steps={}, usage={}", run.runId, reason, run.steps.size(), run.usage);
        observers.runFinished(result);
        return result;
    }

    private RunTerminalReason loop(RunContext run) {
        for (int stepNumber = 1; ; stepNumber++) {
            run.stepNumber = stepNumber;
            if (run.cancellation.isCancelled()) {
                log.info("[run:{}][step:{}] cancelled before model call", run.runId, stepNumber);
                run.transition(AgentRunState.CANCELLED);
                return RunTerminalReason.CANCELLED;
            }
            StepOutcome outcome = executeStep(run, stepNumber);
            switch (outcome) {
                case FINISH -> {
                    run.transition(AgentRunState.FINISHED);
                    return RunTerminalReason.FINISHED;
                }
                case STOPPED -> {
                    run.transition(AgentRunState.STOPPED);
                    return RunTerminalReason.STOPPED;
                }
                case CANCELLED -> {
                    run.transition(AgentRunState.CANCELLED);
                    return RunTerminalReason.CANCELLED;
                }
                case ERROR -> {
                    run.transition(AgentRunState.ERRORED);
                    return RunTerminalReason.ERRORED;
                }
                case TOOL_CALLS_PENDING -> {
                    if (stepNumber >= run.budget.maxSteps()) {
                        log.info("[run:{}][step:{}] step limit reached", run.runId, stepNumber);
                        run.transition(AgentRunState.FINISHED);
                        return RunTerminalReason.MAX_STEPS;
                    }
                }
            }
        }
    }

    private StepOutcome executeStep(RunContext run, int stepNumber) {
        run.spec.observers().stepStarted(stepNumber);
        run.transition(AgentRunState.REQUESTING_GENERATION);

        StepState step = new StepState(stepNumber);
        ModelRequest request = new ModelRequest(
                run.spec.model(),
                run.spec.systemPrompt(),
                run.conversation.messages(),
                ModelRequest.toolsOf(run.spec.tools()),
                null
        );
        ProviderProtocol protocol = run.spec.protocol() == null ? transport.protocol() : run.spec.protocol();
        StreamNormalizer normalizer = normalizerFactory.create(protocol);
        log.debug("[run:{}][step:{}] model call protocol={}, messages={}", run.runId, stepNumber, protocol, request.messages().size());

        Flux<String> chunks = Flux.defer(() -> transport.issueModelCall(request, run.cancellation))
                .takeUntilOther(run.cancellation.whenCancelled());
        run.transition(AgentRunState.CONSUMING_EVENTS);
        StepOutcome consumed = consume(run, step, normalizer, chunks);

        if (consumed == StepOutcome.ERROR) {
            log.warn("[run:{}][step:{}] step failed", run.runId, stepNumber, step.fatal);
            run.error = step.fatal;
            return finishStep(run, step, StepOutcome.ERROR);
        }
        // the signal may fire while the last events of the response are delivered
        if (consumed == StepOutcome.CANCELLED || run.cancellation.isCancelled()) {
            log.info("[run:{}][step:{}] cancelled while streaming", run.runId, stepNumber);
            return finishStep(run, step, StepOutcome.CANCELLED);
        }

        boolean stopped = consumed == StepOutcome.STOPPED;
        if (!step.toolCalls.isEmpty()) {
            run.transition(AgentRunState.DISPATCHING_TOOLS);
            stopped |= dispatchTools(run, step);
            if (run.cancellation.isCancelled()) {
                log.info("[run:{}][step:{}] cancelled during tool dispatch", run.runId, stepNumber);
                return finishStep(run, step, StepOutcome.CANCELLED);
            }
        }

        run.conversation.appendStep(step.text.toString(), step.toolCalls, step.toolResults);
        run.usage = run.usage.plus(step.usage);

        StepOutcome outcome;
        if (stopped) {
            outcome = StepOutcome.STOPPED;
        } else if (step.toolCalls.isEmpty()) {
            outcome = StepOutcome.FINISH;
        } else {
            outcome = StepOutcome.TOOL_CALLS_PENDING;
        }
        StreamEvent.StepFinish stepFinish = new StreamEvent.StepFinish(stepNumber, step.finishReason, step.usage);
        step.events.add(stepFinish);
        if (publish(run, stepFinish) == ObserverSignal.STOP && outcome == StepOutcome.TOOL_CALLS_PENDING) {
            outcome = StepOutcome.STOPPED;
        }
        log.debug("[run:{}][step:{}] step done outcome={}, toolCalls={}, finishReason={}",
                run.runId, stepNumber, outcome, step.toolCalls.size(), step.finishReason);
        return finishStep(run, step, outcome);
    }

    private StepOutcome consume(RunContext run, StepState step, StreamNormalizer normalizer, Flux<String> chunks) {
        try (Stream<String> stream = chunks.toStream()) {
            Iterator<String> iterator = stream.iterator();
            while (true) {
                String chunk;
                try {
                    chunk = iterator.hasNext() ? iterator.next() : null;
                } catch (RuntimeException ex) {
                    if (run.cancellation.isCancelled()) {
                        return StepOutcome.CANCELLED;
                    }
                    Throwable cause = Exceptions.unwrap(ex);
                    step.fatal = cause instanceof ModelCallException
                            ? cause
                            : new ModelCallException("model call failed: " + cause.getMessage(), cause);
                    return StepOutcome.ERROR;
                }
                if (run.cancellation.isCancelled()) {
                    return StepOutcome.CANCELLED;
                }
                List<StreamEvent> events = chunk == null ? normalizer.complete() : normalizer.normalize(chunk);
                for (StreamEvent event : events) {
                    StepOutcome outcome = accept(run, step, event);
                    if (outcome != null) {
                        return outcome;
                    }
                }
                if (chunk == null) {
                    return StepOutcome.FINISH;
                }
            }
        }
    }

    /**
     * @return {@code null} to keep consuming, otherwise the reason consumption ended
     */
    private StepOutcome accept(RunContext run, StepState step, StreamEvent event) {
        step.events.add(event);
        if (event instanceof StreamEvent.TextDelta textDelta) {
            step.text.append(textDelta.delta());
        } else if (event instanceof StreamEvent.ReasoningDelta reasoningDelta) {
            step.reasoning.append(reasoningDelta.delta());
        } else if (event instanceof StreamEvent.ToolCallEnd toolCallEnd) {
            step.toolCalls.add(toolCallEnd);
        } else if (event instanceof StreamEvent.Finish finish) {
            step.finishReason = finish.finishReason();
            step.usage = finish.usage();
        } else if (event instanceof StreamEvent.Error error) {
            step.fatal = error.cause();
        }
        ObserverSignal signal = publish(run, event);
        if (step.fatal != null) {
            return StepOutcome.ERROR;
        }
        if (signal == ObserverSignal.STOP) {
            log.info("[run:{}][step:{}] observer requested stop at {}", run.runId, step.stepNumber, event.kind());
            return StepOutcome.STOPPED;
        }
        return null;
    }

    /**
     * @return {@code true} if an observer asked to stop while results were delivered
     */
    private boolean dispatchTools(RunContext run, StepState step) {
        log.debug("[run:{}][step:{}] dispatching {} tool call(s)", run.runId, step.stepNumber, step.toolCalls.size());
        boolean stopped = false;
        Flux<StreamEvent.ToolResult> results = toolDispatcher.dispatch(
                step.toolCalls,
                run.spec.tools(),
                run.cancellation,
                run.budget.toolTimeout()
        );
        try (Stream<StreamEvent.ToolResult> stream = results.toStream()) {
            Iterator<StreamEvent.ToolResult> iterator = stream.iterator();
            while (iterator.hasNext()) {
                StreamEvent.ToolResult result = iterator.next();
                step.toolResults.add(result);
                step.events.add(result);
                if (publish(run, result) == ObserverSignal.STOP) {
                    stopped = true;
                }
            }
        }
        return stopped;
    }

    private ObserverSignal publish(RunContext run, StreamEvent event) {
        run.eventSink.accept(event);
        return run.spec.observers().deliver(event);
    }

    private StepOutcome finishStep(RunContext run, StepState step, StepOutcome outcome) {
        AgentStep agentStep = new AgentStep(
                step.stepNumber,
                step.events,
                step.toolCalls,
                step.toolResults,
                step.text.toString(),
                step.reasoning.toString(),
                step.finishReason,
                step.usage,
                outcome
        );
        run.steps.add(agentStep);
        run.spec.observers().stepFinished(agentStep);
        return outcome;
    }

    private static final class RunContext {

        private final String runId = UUID.randomUUID().toString().substring(0, 8);
        private final AgentRunSpec spec;
        private final Budget budget;
        private final CancellationSignal cancellation;
        private final ConversationAccumulator conversation;
        private final Consumer<StreamEvent> eventSink;
        private final List<AgentStep> steps = new ArrayList<>();

        private AgentRunState state = AgentRunState.IDLE;
        private int stepNumber;
        private Usage usage = Usage.EMPTY;
        private Throwable error;

        private RunContext(
                AgentRunSpec spec,
                Budget budget,
                CancellationSignal cancellation,
                ConversationAccumulator conversation,
                Consumer<StreamEvent> eventSink
        ) {
            this.spec = spec;
            this.budget = budget;
            this.cancellation = cancellation;
            this.conversation = conversation;
            this.eventSink = eventSink;
        }

        private void transition(AgentRunState next) {
            if (state == next || state.isTerminal()) {
                return;
            }
            log.debug("[run:{}][step:{}] {} -> {}", runId, stepNumber, state, next);
            state = next;
        }
    }

    private static final class StepState {

        private final int stepNumber;
        private final List<StreamEvent> events = new ArrayList<>();
        private final List<StreamEvent.ToolCallEnd> toolCalls = new ArrayList<>();
        private final List<StreamEvent.ToolResult> toolResults = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();
        private final StringBuilder reasoning = new StringBuilder();
        private FinishReason finishReason = FinishReason.UNKNOWN;
        private Usage usage = Usage.EMPTY;
        private Throwable fatal;

        private StepState(int stepNumber) {
            this.stepNumber = stepNumber;
        }
    }
}
