package com.linlay.agentruntime.agent.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot, thread-safe cancellation for a run. Fires on {@link #cancel()} or when the optional
 * deadline passes, whichever comes first, and never resets.
 */
public final class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Sinks.Empty<Void> sink = Sinks.empty();
    private final Instant deadline;
    private final Disposable deadlineTimer;

    private CancellationSignal(Duration timeout) {
        if (timeout == null) {
            this.deadline = null;
            this.deadlineTimer = null;
            return;
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        this.deadline = Instant.now().plus(timeout);
        this.deadlineTimer = Mono.delay(timeout).subscribe(ignored -> {
            if (cancel()) {
                log.debug("Cancellation deadline of {} reached", timeout);
            }
        });
    }

    public static CancellationSignal create() {
        return new CancellationSignal(null);
    }

    public static CancellationSignal withTimeout(Duration timeout) {
        return new CancellationSignal(timeout);
    }

    /**
     * @return {@code true} if this call fired the signal, {@code false} if it had already fired
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        if (deadlineTimer != null) {
            deadlineTimer.dispose();
        }
        sink.tryEmitEmpty();
        return true;
    }

    public boolean isCancelled() {
        if (cancelled.get()) {
            return true;
        }
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            cancel();
            return true;
        }
        return false;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("run cancelled");
        }
    }

    /**
     * Completes (empty) once the signal fires. Meant for {@code takeUntilOther}.
     */
    public Mono<Void> whenCancelled() {
        return sink.asMono();
    }

    public Disposable onCancel(Runnable action) {
        return whenCancelled().subscribe(null, null, action);
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }
}
