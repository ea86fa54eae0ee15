package com.pitwall.resilience;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class UpstreamCircuitBreakerTest {

    private static final Duration RECOVERY = Duration.ofMillis(200);

    private UpstreamCircuitBreaker breaker;
    private AtomicInteger invocations;

    @BeforeEach
    void setUp() {
        breaker = new UpstreamCircuitBreaker("test-upstream", 3, RECOVERY);
        invocations = new AtomicInteger();
    }

    @Test
    void opensAfterThresholdConsecutiveFailures() {
        fail(2);
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());

        fail(1);
        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
        assertEquals(3, breaker.getStats().failureCount());
        assertNotNull(breaker.getStats().lastFailureTime());
    }

    @Test
    void successResetsConsecutiveFailures() {
        fail(2);
        assertEquals("ok", breaker.execute(() -> "ok"));
        fail(2);

        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        assertEquals(2, breaker.getStats().failureCount());
    }

    @Test
    void openBreakerRejectsWithoutInvokingAction() {
        fail(3);
        int before = invocations.get();

        assertThrows(CallNotPermittedException.class, () -> breaker.execute(counting(() -> "x")));
        assertEquals(before, invocations.get());
        assertEquals(1, breaker.getStats().rejectedRequests());
    }

    @Test
    void openBreakerReturnsFallbackWhenSupplied() {
        fail(3);

        List<String> result = breaker.execute(counting(() -> List.of("live")), List.of());

        assertTrue(result.isEmpty());
        assertEquals(3, invocations.get());
    }

    @Test
    void failureBelowThresholdPropagatesEvenWithFallback() {
        assertThrows(IllegalStateException.class,
                () -> breaker.execute(() -> { throw new IllegalStateException("boom"); }, "fallback"));
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
    }

    @Test
    void failureReachingThresholdReturnsFallback() {
        fail(2);

        String result = breaker.execute(() -> { throw new IllegalStateException("boom"); }, "fallback");

        assertEquals("fallback", result);
        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
    }

    @Test
    void successfulProbeAfterRecoveryIntervalCloses() throws InterruptedException {
        fail(3);
        Thread.sleep(RECOVERY.toMillis() + 100);

        assertEquals("probe", breaker.execute(counting(() -> "probe")));

        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getStats().failureCount());
    }

    @Test
    void failedProbeReopens() throws InterruptedException {
        fail(3);
        Thread.sleep(RECOVERY.toMillis() + 100);

        String result = breaker.execute(() -> { throw new IllegalStateException("still down"); }, "fallback");

        assertEquals("fallback", result);
        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
        assertThrows(CallNotPermittedException.class, () -> breaker.execute(() -> "x"));
    }

    @Test
    void onlyOneProbeRunsWhileHalfOpen() throws Exception {
        fail(3);
        Thread.sleep(RECOVERY.toMillis() + 100);

        CountDownLatch probeStarted = new CountDownLatch(1);
        CountDownLatch releaseProbe = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Future<String> probe = executor.submit(() -> breaker.execute(() -> {
                probeStarted.countDown();
                await(releaseProbe);
                return "probe";
            }));

            assertTrue(probeStarted.await(2, TimeUnit.SECONDS));
            assertEquals(CircuitBreakerState.HALF_OPEN, breaker.getState());

            String concurrent = breaker.execute(counting(() -> "second"), "fallback");
            assertEquals("fallback", concurrent);
            assertEquals(3, invocations.get());

            releaseProbe.countDown();
            assertEquals("probe", probe.get(2, TimeUnit.SECONDS));
            assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        } finally {
            releaseProbe.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void lateFailureWhileOpenRestartsRecoveryWait() throws Exception {
        CountDownLatch slowCallStarted = new CountDownLatch(1);
        CountDownLatch releaseSlowCall = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            Future<String> slowCall = executor.submit(() -> breaker.execute(() -> {
                slowCallStarted.countDown();
                await(releaseSlowCall);
                throw new IllegalStateException("timed out");
            }, "fallback"));
            assertTrue(slowCallStarted.await(2, TimeUnit.SECONDS));

            fail(3);
            assertEquals(CircuitBreakerState.OPEN, breaker.getState());

            Thread.sleep(RECOVERY.toMillis() - 50);
            releaseSlowCall.countDown();
            assertEquals("fallback", slowCall.get(2, TimeUnit.SECONDS));

            // recoveryInterval has passed since opening but not since the last failure
            Thread.sleep(100);
            int before = invocations.get();

            assertEquals("fallback", breaker.execute(counting(() -> "too early"), "fallback"));
            assertEquals(before, invocations.get());
            assertEquals(CircuitBreakerState.OPEN, breaker.getState());

            Thread.sleep(RECOVERY.toMillis() + 100);

            assertEquals("probe", breaker.execute(counting(() -> "probe")));
            assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        } finally {
            releaseSlowCall.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void errorThrownByProbeIsRecordedAndReleasesHalfOpenSlot() throws InterruptedException {
        fail(3);
        Thread.sleep(RECOVERY.toMillis() + 100);

        assertThrows(StackOverflowError.class,
                () -> breaker.execute(() -> { throw new StackOverflowError(); }, "fallback"));

        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
        assertEquals(4, breaker.getStats().failedRequests());
        assertEquals(4, breaker.getStats().failureCount());

        Thread.sleep(RECOVERY.toMillis() + 100);
        int before = invocations.get();

        assertEquals("probe", breaker.execute(counting(() -> "probe"), "fallback"));
        assertEquals(before + 1, invocations.get());
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
    }

    @Test
    void statsTrackEveryOutcome() {
        breaker.execute(() -> "a");
        fail(3);
        breaker.execute(() -> "rejected", "fallback");

        CircuitBreakerStats stats = breaker.getStats();
        assertEquals(5, stats.totalRequests());
        assertEquals(1, stats.successfulRequests());
        assertEquals(3, stats.failedRequests());
        assertEquals(1, stats.rejectedRequests());
        assertEquals(3, stats.failureThreshold());
        assertEquals(RECOVERY, stats.recoveryInterval());
    }

    @Test
    void resetClosesAndZeroesCounters() {
        fail(3);

        breaker.reset();

        CircuitBreakerStats stats = breaker.getStats();
        assertEquals(CircuitBreakerState.CLOSED, stats.state());
        assertEquals(0, stats.failureCount());
        assertNull(stats.lastFailureTime());
        assertEquals(0, stats.totalRequests());
        assertEquals(0, stats.failedRequests());
        assertEquals("ok", breaker.execute(() -> "ok"));
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> new UpstreamCircuitBreaker("bad", 0, RECOVERY));
        assertThrows(IllegalArgumentException.class,
                () -> new UpstreamCircuitBreaker("bad", 1, Duration.ZERO));
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            try {
                breaker.execute(counting(() -> { throw new IllegalStateException("upstream down"); }), "fallback");
            } catch (IllegalStateException expected) {
                // below threshold the failure propagates
            }
        }
    }

    private <T> Supplier<T> counting(Supplier<T> action) {
        return () -> {
            invocations.incrementAndGet();
            return action.get();
        };
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
