package com.pitwall.service;

import com.pitwall.cache.CacheStats;
import com.pitwall.cache.KeyValueCache;
import com.pitwall.dto.CacheToggleResponse;
import com.pitwall.dto.CircuitBreakerHealth;
import com.pitwall.dto.SystemHealthStatus;
import com.pitwall.resilience.CircuitBreakerState;
import com.pitwall.resilience.CircuitBreakerStats;
import com.pitwall.resilience.UpstreamCircuitBreaker;
import com.pitwall.state.CacheAvailability;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class SystemHealthService {

    private final UpstreamCircuitBreaker circuitBreaker;
    private final KeyValueCache cache;
    private final CacheAvailability cacheAvailability;

    /**
     * 운영 상태 판단
     *
     * - CircuitBreaker OPEN       → DOWN (upstream 차단 중, 캐시 적중분만 응답 가능)
     * - CircuitBreaker HALF_OPEN  → DEGRADED
     * - 캐시 사용 불가            → DEGRADED (모든 요청이 upstream 으로 전달)
     */
    public SystemHealthStatus getCurrentStatus() {

        CircuitBreakerState state = circuitBreaker.getState();
        boolean cacheReady = cacheAvailability.isReady();

        /* CircuitBreaker 상태가 최우선 */
        if (state == CircuitBreakerState.OPEN) {
            return new SystemHealthStatus("DOWN", state.name(), cacheReady, "CIRCUIT_BREAKER_OPEN");
        }

        if (state == CircuitBreakerState.HALF_OPEN) {
            return new SystemHealthStatus("DEGRADED", state.name(), cacheReady, "CIRCUIT_BREAKER_HALF_OPEN");
        }

        if (!cacheAvailability.isEnabled()) {
            return new SystemHealthStatus("DEGRADED", state.name(), false, "CACHE_DISABLED");
        }

        if (!cacheReady) {
            return new SystemHealthStatus("DEGRADED", state.name(), false, "CACHE_UNAVAILABLE");
        }

        return new SystemHealthStatus("UP", state.name(), true, null);
    }

    public CircuitBreakerHealth getCircuitBreakerHealth() {
        CircuitBreakerStats stats = circuitBreaker.getStats();
        return new CircuitBreakerHealth(stats, healthLabel(stats.state()));
    }

    public CircuitBreakerHealth resetCircuitBreaker() {
        circuitBreaker.reset();
        return getCircuitBreakerHealth();
    }

    public CacheStats getCacheStats() {
        return cache.stats();
    }

    /**
     * 캐시 사용 여부를 ON ↔ OFF로 전환
     * OFF 동안은 모든 조회가 miss 로 처리된다
     */
    public CacheToggleResponse toggleCache() {
        boolean next = cacheAvailability.toggleEnabled();

        String message = String.format("%s -> %s", next ? "OFF" : "ON", next ? "ON" : "OFF");
        log.info("Cache toggled: {}", message);

        return new CacheToggleResponse(next, message);
    }

    private static String healthLabel(CircuitBreakerState state) {
        return switch (state) {
            case CLOSED -> "healthy";
            case HALF_OPEN -> "recovering";
            case OPEN -> "unhealthy";
        };
    }
}
