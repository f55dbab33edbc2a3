package com.agentmeta.evaluation.job;

import com.agentmeta.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * One independently scheduled evaluation loop.
 *
 * <pre>
 *   delay(0) → iteration → delay(interval) → iteration → ...
 *                  └─ on error → delay(fallbackDelay) → iteration → ...
 * </pre>
 *
 * <p>Each iteration is a fresh {@link Mono} whose terminal subscription schedules the
 * next one, so nothing nests and no thread blocks during the wait. An iteration error
 * is logged and the loop carries on; it never propagates to other cycles.
 *
 * <p>{@link #stop()} disposes only the pending wait. An iteration already in flight runs
 * to completion, so writes it started are not cut short, but it schedules nothing after.
 * Every {@link #start()} opens a new generation and a loop only reschedules while its own
 * generation is current, so an iteration that outlives a stop/start pair ends its loop
 * instead of running beside the new one.
 */
public class EvaluationCycle {

    private static final Logger log = LoggerFactory.getLogger(EvaluationCycle.class);

    private final String name;
    private final Duration interval;
    private final Duration fallbackDelay;
    private final Supplier<Mono<?>> iteration;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong generation = new AtomicLong();
    private final AtomicReference<Disposable> pendingWait = new AtomicReference<>();
    private final AtomicLong completedIterations = new AtomicLong();
    private final AtomicLong failedIterations = new AtomicLong();

    public EvaluationCycle(String name, Duration interval, Duration fallbackDelay, Supplier<Mono<?>> iteration) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive for cycle " + name);
        }
        this.name          = name;
        this.interval      = interval;
        this.fallbackDelay = fallbackDelay;
        this.iteration     = iteration;
    }

    /** Starts the loop; the first iteration runs immediately. No-op when already running. */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Cycle already running. cycle={}", name);
            return;
        }
        long current = generation.incrementAndGet();
        log.info("Cycle started. cycle={} intervalSeconds={} generation={}", name, interval.toSeconds(), current);
        scheduleNext(current, Duration.ZERO);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        generation.incrementAndGet();
        Disposable wait = pendingWait.getAndSet(null);
        if (wait != null) {
            wait.dispose();
        }
        log.info("Cycle stopped. cycle={} completed={} failed={}",
                 name, completedIterations.get(), failedIterations.get());
    }

    /**
     * A single traced iteration. Errors are counted, logged and re-emitted so the
     * caller decides how to continue.
     */
    public Mono<Void> runOnce() {
        return Mono.defer(() -> {
            String traceId = TraceContextUtil.newTraceId();
            long startedAt = System.nanoTime();

            Mono<Void> pipeline = Mono.defer(() -> iteration.get().then())
                .doOnSuccess(v -> {
                    completedIterations.incrementAndGet();
                    long elapsedMs = Duration.ofNanos(System.nanoTime() - startedAt).toMillis();
                    TraceContextUtil.withMdc(traceId, name, () ->
                        log.info("CYCLE_COMPLETED cycle={} elapsedMs={} traceId={}", name, elapsedMs, traceId));
                })
                .doOnError(e -> {
                    failedIterations.incrementAndGet();
                    TraceContextUtil.withMdc(traceId, name, () ->
                        log.error("CYCLE_FAILED cycle={} traceId={}", name, traceId, e));
                });

            return TraceContextUtil.withTrace(pipeline, name, traceId);
        });
    }

    // ── loop ─────────────────────────────────────────────────────────────────

    private boolean isCurrent(long loopGeneration) {
        return running.get() && generation.get() == loopGeneration;
    }

    private void scheduleNext(long loopGeneration, Duration delay) {
        if (!isCurrent(loopGeneration)) {
            return;
        }
        Disposable wait = Mono.delay(delay).subscribe(tick -> runIteration(loopGeneration));
        pendingWait.set(wait);
        // stop() may have run between the check above and the set
        if (!isCurrent(loopGeneration)) {
            wait.dispose();
        }
    }

    private void runIteration(long loopGeneration) {
        if (!isCurrent(loopGeneration)) {
            return;
        }
        runOnce().subscribe(
            v -> { },
            err -> scheduleNext(loopGeneration, fallbackDelay),
            () -> scheduleNext(loopGeneration, interval));
    }

    public String name() {
        return name;
    }

    public Duration interval() {
        return interval;
    }

    public boolean isRunning() {
        return running.get();
    }

    public long completedIterations() {
        return completedIterations.get();
    }

    public long failedIterations() {
        return failedIterations.get();
    }
}
