package com.agentmeta.evaluation.job;

import com.agentmeta.common.trace.TraceContextUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationCycleTest {

    private final List<EvaluationCycle> started = new ArrayList<>();

    @AfterEach
    void stopAll() {
        started.forEach(EvaluationCycle::stop);
    }

    @Nested
    @DisplayName("runOnce()")
    class RunOnceTests {

        @Test
        @DisplayName("successful iteration completes and is counted")
        void success() {
            EvaluationCycle cycle = new EvaluationCycle("ranking", Duration.ofSeconds(1), Duration.ofSeconds(1),
                () -> Mono.just(5));

            cycle.runOnce().block();

            assertEquals(1, cycle.completedIterations());
            assertEquals(0, cycle.failedIterations());
        }

        @Test
        @DisplayName("failing iteration re-emits the error and is counted")
        void failure() {
            EvaluationCycle cycle = new EvaluationCycle("ranking", Duration.ofSeconds(1), Duration.ofSeconds(1),
                () -> Mono.error(new IllegalStateException("boom")));

            assertThrows(IllegalStateException.class, () -> cycle.runOnce().block());
            assertEquals(1, cycle.failedIterations());
        }

        @Test
        @DisplayName("iteration sees a fresh trace id and its cycle name in the Reactor context")
        void traceContext() {
            AtomicReference<String> traceId = new AtomicReference<>();
            AtomicReference<String> cycleName = new AtomicReference<>();
            EvaluationCycle cycle = new EvaluationCycle("rotation", Duration.ofSeconds(1), Duration.ofSeconds(1),
                () -> Mono.deferContextual(ctx -> {
                    traceId.set(TraceContextUtil.getTraceId(ctx));
                    cycleName.set(TraceContextUtil.getCycle(ctx));
                    return Mono.empty();
                }));

            cycle.runOnce().block();
            String first = traceId.get();
            cycle.runOnce().block();

            assertEquals("rotation", cycleName.get());
            assertNotEquals("unknown", first);
            assertNotEquals(first, traceId.get());
        }
    }

    @Nested
    @DisplayName("start() / stop()")
    class LoopTests {

        @Test
        @DisplayName("first iteration runs immediately, then repeats every interval")
        void repeats() throws InterruptedException {
            CountDownLatch threeRuns = new CountDownLatch(3);
            EvaluationCycle cycle = start(new EvaluationCycle("performance", Duration.ofMillis(50),
                Duration.ofMillis(50), () -> Mono.fromRunnable(threeRuns::countDown)));

            assertTrue(threeRuns.await(5, TimeUnit.SECONDS));
            assertTrue(cycle.isRunning());
        }

        @Test
        @DisplayName("a failing iteration is followed by another after the fallback delay")
        void keepsGoingAfterFailure() throws InterruptedException {
            CountDownLatch threeRuns = new CountDownLatch(3);
            EvaluationCycle cycle = start(new EvaluationCycle("regime", Duration.ofSeconds(60), Duration.ofMillis(20),
                () -> Mono.defer(() -> {
                    threeRuns.countDown();
                    return Mono.error(new IllegalStateException("market data down"));
                })));

            assertTrue(threeRuns.await(5, TimeUnit.SECONDS));
            assertTrue(cycle.failedIterations() >= 2);
        }

        @Test
        @DisplayName("a permanently failing cycle does not prevent another cycle's iterations")
        void failureIsolated() throws InterruptedException {
            CountDownLatch healthyRuns = new CountDownLatch(3);
            start(new EvaluationCycle("regime", Duration.ofMillis(30), Duration.ofMillis(30),
                () -> Mono.error(new IllegalStateException("always fails"))));
            start(new EvaluationCycle("ranking", Duration.ofMillis(30), Duration.ofMillis(30),
                () -> Mono.fromRunnable(healthyRuns::countDown)));

            assertTrue(healthyRuns.await(5, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("stop() prevents any further iteration")
        void stopPreventsReschedule() throws InterruptedException {
            AtomicInteger runs = new AtomicInteger();
            CountDownLatch firstRun = new CountDownLatch(1);
            EvaluationCycle cycle = start(new EvaluationCycle("rotation", Duration.ofMillis(50), Duration.ofMillis(50),
                () -> Mono.fromRunnable(() -> {
                    runs.incrementAndGet();
                    firstRun.countDown();
                })));

            assertTrue(firstRun.await(5, TimeUnit.SECONDS));
            cycle.stop();
            Thread.sleep(60);
            int afterStop = runs.get();
            Thread.sleep(300);

            assertFalse(cycle.isRunning());
            assertEquals(afterStop, runs.get());
        }

        @Test
        @DisplayName("stop() lets an in-flight iteration finish its work")
        void inFlightCompletes() throws InterruptedException {
            CountDownLatch inFlight = new CountDownLatch(1);
            CountDownLatch written = new CountDownLatch(1);
            EvaluationCycle cycle = start(new EvaluationCycle("performance", Duration.ofSeconds(60),
                Duration.ofSeconds(60), () -> Mono.fromRunnable(inFlight::countDown)
                    .then(Mono.delay(Duration.ofMillis(150)))
                    .then(Mono.fromRunnable(written::countDown))));

            assertTrue(inFlight.await(5, TimeUnit.SECONDS));
            cycle.stop();

            assertTrue(written.await(5, TimeUnit.SECONDS));
            assertFalse(cycle.isRunning());
        }

        @Test
        @DisplayName("an iteration that outlives stop() + start() does not leave a second loop behind")
        void restartWhileInFlightKeepsOneLoop() throws InterruptedException {
            Sinks.One<Void> held = Sinks.one();
            AtomicInteger calls = new AtomicInteger();
            CountDownLatch inFlight = new CountDownLatch(1);
            CountDownLatch restarted = new CountDownLatch(1);
            EvaluationCycle cycle = start(new EvaluationCycle("performance", Duration.ofMillis(150),
                Duration.ofMillis(150), () -> {
                    int call = calls.incrementAndGet();
                    if (call == 1) {
                        inFlight.countDown();
                        return held.asMono();
                    }
                    if (call == 2) {
                        restarted.countDown();
                    }
                    return Mono.empty();
                }));

            assertTrue(inFlight.await(5, TimeUnit.SECONDS));
            cycle.stop();
            cycle.start();
            assertTrue(restarted.await(5, TimeUnit.SECONDS));

            held.tryEmitEmpty();
            int atRelease = calls.get();
            Thread.sleep(1_000);

            // one loop at 150ms fits about 7 iterations in a second, two loops about 14
            int inWindow = calls.get() - atRelease;
            assertTrue(inWindow <= 9, () -> "iterations after release: " + inWindow);
            assertTrue(cycle.isRunning());
        }

        @Test
        @DisplayName("start() twice runs a single loop")
        void startIsIdempotent() throws InterruptedException {
            AtomicInteger runs = new AtomicInteger();
            CountDownLatch firstRun = new CountDownLatch(1);
            EvaluationCycle cycle = start(new EvaluationCycle("ranking", Duration.ofSeconds(60), Duration.ofSeconds(60),
                () -> Mono.fromRunnable(() -> {
                    runs.incrementAndGet();
                    firstRun.countDown();
                })));
            cycle.start();

            assertTrue(firstRun.await(5, TimeUnit.SECONDS));
            Thread.sleep(100);
            assertEquals(1, runs.get());
        }
    }

    @Test
    @DisplayName("non-positive interval is rejected")
    void rejectsZeroInterval() {
        assertThrows(IllegalArgumentException.class,
            () -> new EvaluationCycle("bad", Duration.ZERO, Duration.ofSeconds(1), Mono::empty));
    }

    private EvaluationCycle start(EvaluationCycle cycle) {
        started.add(cycle);
        cycle.start();
        return cycle;
    }
}
