package com.pitwall.client;

import com.pitwall.domain.DataCategory;
import lombok.Getter;

/**
 * Upstream 호출 실패 (non-2xx, 네트워크 오류, timeout, 응답 형식 오류)
 *
 * CircuitBreaker 관점에서는 모두 실패로 집계된다.
 * OPEN 상태 거부(CallNotPermittedException)와는 구분된다.
 */
@Getter
public class UpstreamException extends RuntimeException {

    private final DataCategory category;

    /** HTTP 응답을 받지 못한 경우 -1 */
    private final int statusCode;

    public UpstreamException(DataCategory category, int statusCode, String message) {
        super(message);
        this.category = category;
        this.statusCode = statusCode;
    }

    public UpstreamException(DataCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.statusCode = -1;
    }
}
