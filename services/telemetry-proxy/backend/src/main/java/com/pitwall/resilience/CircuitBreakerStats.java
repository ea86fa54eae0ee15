package com.pitwall.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * 운영 조회용 CircuitBreaker 스냅샷
 */
public record CircuitBreakerStats(
        String name,
        CircuitBreakerState state,
        int failureCount,           // 연속 실패 횟수
        Instant lastFailureTime,    // null 가능
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        long rejectedRequests,      // OPEN 상태에서 action 없이 거부된 요청
        int failureThreshold,
        Duration recoveryInterval
) {}
