package com.pitwall.controller;

import com.pitwall.cache.CacheStats;
import com.pitwall.dto.CacheToggleResponse;
import com.pitwall.dto.CircuitBreakerHealth;
import com.pitwall.dto.DefaultResponse;
import com.pitwall.dto.SystemHealthStatus;
import com.pitwall.service.SystemHealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
public class HealthController {

    private final SystemHealthService systemHealthService;

    /**
     * 운영 상태 판단용 Health API
     * - DOWN인 경우 503 반환
     */
    @GetMapping
    public ResponseEntity<DefaultResponse<SystemHealthStatus>> health() {

        SystemHealthStatus status = systemHealthService.getCurrentStatus();

        HttpStatus httpStatus =
                "DOWN".equals(status.getStatus())
                        ? HttpStatus.SERVICE_UNAVAILABLE
                        : HttpStatus.OK;

        return ResponseEntity
                .status(httpStatus)
                .body(DefaultResponse.success(httpStatus.value(), status));
    }

    @GetMapping("/circuit-breaker")
    public ResponseEntity<DefaultResponse<CircuitBreakerHealth>> circuitBreaker() {
        return ok(systemHealthService.getCircuitBreakerHealth());
    }

    /**
     * 운영자 수동 리셋: CLOSED + 카운터 초기화
     */
    @PostMapping("/circuit-breaker/reset")
    public ResponseEntity<DefaultResponse<CircuitBreakerHealth>> resetCircuitBreaker() {
        return ok(systemHealthService.resetCircuitBreaker());
    }

    @GetMapping("/cache")
    public ResponseEntity<DefaultResponse<CacheStats>> cache() {
        return ok(systemHealthService.getCacheStats());
    }

    /**
     * 캐시 ON/OFF 토글
     * - 서버 재시작 없이 always-miss 모드로 전환 가능
     */
    @PostMapping("/cache/toggle")
    public ResponseEntity<DefaultResponse<CacheToggleResponse>> toggleCache() {
        return ok(systemHealthService.toggleCache());
    }

    private static <T> ResponseEntity<DefaultResponse<T>> ok(T body) {
        return ResponseEntity.ok(DefaultResponse.success(HttpStatus.OK.value(), body));
    }
}
