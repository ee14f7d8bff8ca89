package com.linlay.agentruntime.agent.runtime;

import com.linlay.agentruntime.stream.model.StreamEvent;
import com.linlay.agentruntime.stream.model.StreamEventKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class StreamObserversTest {

    @Test
    void shouldDeliverOnlyToObserversOfTheEventKind() {
        List<String> seen = new ArrayList<>();
        StreamObservers observers = StreamObservers.builder()
                .onTextDelta(delta -> {
                    seen.add("text:" + delta.delta());
                    return ObserverSignal.CONTINUE;
                })
                .on(StreamEventKind.REASONING_START, event -> {
                    seen.add("reasoning");
                    return ObserverSignal.CONTINUE;
                })
                .build();

        observers.deliver(new StreamEvent.TextDelta("text-1", "hi"));
        observers.deliver(new StreamEvent.ReasoningStart("reasoning-1"));
        observers.deliver(new StreamEvent.ReasoningEnd("reasoning-1"));

        assertThat(seen).containsExactly("text:hi", "reasoning");
    }

    @Test
    void shouldStopWhenAnyObserverAsksToStopButStillCallTheOthers() {
        List<String> seen = new ArrayList<>();
        StreamObservers observers = StreamObservers.builder()
                .onTextDelta(delta -> ObserverSignal.STOP)
                .onEvent(event -> {
                    seen.add(event.kind().name());
                    return ObserverSignal.CONTINUE;
                })
                .build();

        ObserverSignal signal = observers.deliver(new StreamEvent.TextDelta("text-1", "hi"));

        assertThat(signal).isEqualTo(ObserverSignal.STOP);
        assertThat(seen).containsExactly("TEXT_DELTA");
    }

    @Test
    void failingLifecycleHookShouldNotEscape() {
        List<Integer> steps = new ArrayList<>();
        StreamObservers observers = StreamObservers.builder()
                .onStepStart(step -> {
                    throw new IllegalStateException("hook failed");
                })
                .onStepStart(steps::add)
                .build();

        assertThatCode(() -> observers.stepStarted(2)).doesNotThrowAnyException();
        assertThat(steps).containsExactly(2);
    }

    @Test
    void noneShouldContinueForEveryEvent() {
        assertThat(StreamObservers.none().deliver(new StreamEvent.Finish(null, null))).isEqualTo(ObserverSignal.CONTINUE);
    }
}
