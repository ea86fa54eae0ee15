package com.pitwall.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

public enum CircuitBreakerState {

    /** 정상 동작 (요청 통과) */
    CLOSED,

    /** 차단 상태 (요청 거부 또는 fallback) */
    OPEN,

    /** 복구 확인용 단일 probe 요청 허용 */
    HALF_OPEN;

    static CircuitBreakerState from(CircuitBreaker.State state) {
        return switch (state) {
            case OPEN, FORCED_OPEN -> OPEN;
            case HALF_OPEN -> HALF_OPEN;
            default -> CLOSED;
        };
    }
}
