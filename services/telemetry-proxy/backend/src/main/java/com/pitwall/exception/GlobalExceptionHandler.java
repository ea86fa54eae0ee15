package com.pitwall.exception;

import com.pitwall.client.UpstreamException;
import com.pitwall.dto.DefaultResponse;
import com.pitwall.logging.LogEvent;
import com.pitwall.logging.TraceContext;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice(basePackages = "com.pitwall.controller")
public class GlobalExceptionHandler {

    /**
     * CircuitBreaker OPEN 상태에서 fallback 없이 호출된 경우
     *
     * - 서버 내부 오류(500)가 아닌, 보호 상태(503)로 응답
     */
    @ExceptionHandler(CallNotPermittedException.class)
    public ResponseEntity<DefaultResponse<Void>> handleCircuitOpen(CallNotPermittedException e) {

        log.warn(
                "event={} message={} trace_id={}",
                LogEvent.CIRCUIT_OPEN,
                e.getMessage(),
                TraceContext.current()
        );

        return failure(HttpStatus.SERVICE_UNAVAILABLE, LogEvent.CIRCUIT_OPEN, "circuit breaker is open");
    }

    /**
     * Upstream 실패가 임계값 도달 전이라 fallback 없이 전파된 경우
     */
    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<DefaultResponse<Void>> handleUpstream(UpstreamException e) {

        log.warn(
                "event={} category={} status={} trace_id={}",
                LogEvent.UPSTREAM_FAILURE,
                e.getCategory(),
                e.getStatusCode(),
                TraceContext.current()
        );

        return failure(HttpStatus.SERVICE_UNAVAILABLE, "UPSTREAM_UNAVAILABLE", "upstream API is unavailable");
    }

    /**
     * 비즈니스 예외 처리
     * - 정상 흐름 내에서 발생 가능한 예외
     * - ERROR가 아닌 WARN 수준으로 기록
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<DefaultResponse<Void>> handleApiException(ApiException e) {

        log.warn(
                "event={} code={} trace_id={}",
                LogEvent.BUSINESS_EXCEPTION,
                e.getCode(),
                TraceContext.current()
        );

        return failure(e.getStatus(), e.getCode(), e.getMessage());
    }

    /**
     * 쿼리 파라미터 파싱 실패 (예: session_key=abc)
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<DefaultResponse<Void>> handleIllegalArgument(IllegalArgumentException e) {

        log.warn(
                "event={} code=INVALID_PARAM message={} trace_id={}",
                LogEvent.BUSINESS_EXCEPTION,
                e.getMessage(),
                TraceContext.current()
        );

        return failure(HttpStatus.BAD_REQUEST, "INVALID_PARAM", e.getMessage());
    }

    /**
     * 경로 변수 타입 변환 실패 (예: /sessions/abc/preload)
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<DefaultResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {

        String message = e.getName() + " must be a valid " + (e.getRequiredType() == null
                ? "value"
                : e.getRequiredType().getSimpleName());

        log.warn(
                "event={} code=INVALID_PARAM param={} value={} trace_id={}",
                LogEvent.BUSINESS_EXCEPTION,
                e.getName(),
                e.getValue(),
                TraceContext.current()
        );

        return failure(HttpStatus.BAD_REQUEST, "INVALID_PARAM", message);
    }

    /**
     * 예상하지 못한 예외 처리
     * - 반드시 로그를 남겨 "로그 없는 장애"를 방지
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<DefaultResponse<Void>> handleException(Exception e) {
        log.error(
                "event={} trace_id={}",
                LogEvent.UNHANDLED_EXCEPTION,
                TraceContext.current(),
                e
        );

        return failure(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "internal server error");
    }

    private static ResponseEntity<DefaultResponse<Void>> failure(HttpStatus status, String code, String message) {
        return ResponseEntity
                .status(status)
                .body(DefaultResponse.failure(status.value(), code, message));
    }
}
