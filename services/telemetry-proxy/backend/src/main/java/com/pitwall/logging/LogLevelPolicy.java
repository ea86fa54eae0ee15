package com.pitwall.logging;

import com.pitwall.client.UpstreamException;
import com.pitwall.exception.ApiException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.slf4j.event.Level;

/**
 * 로그 레벨 판단 정책
 */
public final class LogLevelPolicy {

    private LogLevelPolicy() {
    }

    /**
     * 예외 기반 로그 레벨 결정
     *
     * - CircuitBreaker OPEN / upstream 장애 : 보호 동작 또는 외부 문제 → WARN
     * - 4xx ApiException                  : 잘못된 요청 → WARN
     * - 그 외                              : ERROR
     */
    public static Level decideByException(Throwable t) {

        if (t == null) {
            return Level.INFO;
        }

        if (t instanceof CallNotPermittedException || t instanceof UpstreamException) {
            return Level.WARN;
        }

        if (t instanceof ApiException api && api.getStatus().is4xxClientError()) {
            return Level.WARN;
        }

        if (t instanceof IllegalArgumentException) {
            return Level.WARN;
        }

        return Level.ERROR;
    }
}
