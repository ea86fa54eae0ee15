package com.pitwall.resilience;

import com.pitwall.logging.LogEvent;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Upstream 의존성 1개당 1개씩 생성되는 CircuitBreaker
 *
 * 상태 머신은 Resilience4j 가 담당한다.
 * - COUNT_BASED window 크기 = failureThreshold, 실패율 임계값 100%
 *   → 최근 failureThreshold 건이 모두 실패(= 연속 실패)해야 OPEN
 * - OPEN → HALF_OPEN 은 마지막 실패 이후 recoveryInterval 경과 후 다음 호출 시점에 전환
 *   (OPEN 중에 도착한 늦은 실패도 대기 시간을 다시 시작한다)
 * - HALF_OPEN 에서는 probe 1건만 허용, 성공 시 CLOSED / 실패 시 OPEN
 *
 * 이 클래스는 그 위에 fallback 정책과 누적 카운터를 얹는다.
 * - OPEN 거부: fallback 이 있으면 fallback, 없으면 CallNotPermittedException
 * - action 실패: fallback 이 있고 연속 실패가 임계값 이상일 때만 fallback, 아니면 예외 전파
 */
@Slf4j
public class UpstreamCircuitBreaker {

    private final String name;
    private final CircuitBreaker delegate;
    private final int failureThreshold;
    private final Duration recoveryInterval;

    // 카운터 read-modify-write 는 모두 lock 안에서 수행
    private final Object lock = new Object();

    private int failureCount;
    private Instant lastFailureTime;
    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private long rejectedRequests;

    public UpstreamCircuitBreaker(String name, int failureThreshold, Duration recoveryInterval) {
        this(CircuitBreakerRegistry.ofDefaults(), name, failureThreshold, recoveryInterval);
    }

    public UpstreamCircuitBreaker(CircuitBreakerRegistry registry,
                                  String name,
                                  int failureThreshold,
                                  Duration recoveryInterval) {
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(recoveryInterval, "recoveryInterval must not be null");

        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (recoveryInterval.isNegative() || recoveryInterval.isZero()) {
            throw new IllegalArgumentException("recoveryInterval must be positive");
        }

        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryInterval = recoveryInterval;

        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(recoveryInterval)
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();

        this.delegate = registry.circuitBreaker(name, config);

        delegate.getEventPublisher().onStateTransition(event ->
                log.warn(
                        "event={} circuit={} transition={}",
                        LogEvent.CIRCUIT_TRANSITION,
                        name,
                        event.getStateTransition()
                )
        );

        log.info(
                "Circuit breaker initialized: name={}, failureThreshold={}, recoveryInterval={}",
                name, failureThreshold, recoveryInterval
        );
    }

    /**
     * fallback 없이 실행
     *
     * @throws CallNotPermittedException OPEN 상태에서 복구 대기 중인 경우
     * @throws RuntimeException          action 이 던진 예외 그대로
     */
    public <T> T execute(Supplier<T> action) {
        return doExecute(action, false, null);
    }

    /**
     * fallback 과 함께 실행
     *
     * - OPEN 으로 거부된 경우 fallback 반환
     * - action 실패 시 연속 실패가 임계값에 도달했을 때만 fallback 반환
     */
    public <T> T execute(Supplier<T> action, T fallback) {
        return doExecute(action, true, fallback);
    }

    private <T> T doExecute(Supplier<T> action, boolean hasFallback, T fallback) {
        Objects.requireNonNull(action, "action must not be null");

        synchronized (lock) {
            totalRequests++;
        }

        try {
            // Resilience4j 의 대기 시간은 OPEN 전환 시점 기준이므로 마지막 실패 기준 대기를 먼저 확인
            if (isWaitingForRecovery()) {
                throw CallNotPermittedException.createCallNotPermittedException(delegate);
            }
            // OPEN 인데 recoveryInterval 이 지났다면 여기서 HALF_OPEN 으로 전환된다
            delegate.acquirePermission();
        } catch (CallNotPermittedException e) {
            synchronized (lock) {
                rejectedRequests++;
            }

            log.warn("event={} circuit={} fallback={}", LogEvent.CIRCUIT_OPEN, name, hasFallback);

            if (hasFallback) {
                return fallback;
            }
            throw e;
        }

        long start = delegate.getCurrentTimestamp();

        T result;
        try {
            result = action.get();
        } catch (RuntimeException e) {
            int failures = recordFailure(start, e);

            if (hasFallback && failures >= failureThreshold) {
                log.warn("event={} circuit={}", LogEvent.FALLBACK, name);
                return fallback;
            }
            throw e;
        } catch (Error e) {
            // permission 을 반납하지 않으면 HALF_OPEN probe 슬롯이 영구히 점유된다
            recordFailure(start, e);
            throw e;
        }

        long elapsed = delegate.getCurrentTimestamp() - start;

        synchronized (lock) {
            delegate.onSuccess(elapsed, delegate.getTimestampUnit());
            successfulRequests++;
            failureCount = 0;
        }
        return result;
    }

    private int recordFailure(long start, Throwable cause) {
        long elapsed = delegate.getCurrentTimestamp() - start;
        int failures;

        synchronized (lock) {
            delegate.onError(elapsed, delegate.getTimestampUnit(), cause);
            failedRequests++;
            failures = ++failureCount;
            lastFailureTime = Instant.now();
        }

        log.warn(
                "event={} circuit={} failures={}/{} cause={}",
                LogEvent.UPSTREAM_FAILURE,
                name,
                failures,
                failureThreshold,
                cause.getClass().getSimpleName()
        );
        return failures;
    }

    private boolean isWaitingForRecovery() {
        if (delegate.getState() != CircuitBreaker.State.OPEN) {
            return false;
        }
        synchronized (lock) {
            return lastFailureTime != null
                    && Instant.now().isBefore(lastFailureTime.plus(recoveryInterval));
        }
    }

    public CircuitBreakerState getState() {
        return CircuitBreakerState.from(delegate.getState());
    }

    public CircuitBreakerStats getStats() {
        synchronized (lock) {
            return new CircuitBreakerStats(
                    name,
                    getState(),
                    failureCount,
                    lastFailureTime,
                    totalRequests,
                    successfulRequests,
                    failedRequests,
                    rejectedRequests,
                    failureThreshold,
                    recoveryInterval
            );
        }
    }

    /**
     * 운영자 수동 리셋: CLOSED + 모든 카운터 0
     */
    public void reset() {
        synchronized (lock) {
            delegate.reset();
            failureCount = 0;
            lastFailureTime = null;
            totalRequests = 0;
            successfulRequests = 0;
            failedRequests = 0;
            rejectedRequests = 0;
        }
        log.info("event={} circuit={}", LogEvent.CIRCUIT_RESET, name);
    }

    public String getName() {
        return name;
    }
}
