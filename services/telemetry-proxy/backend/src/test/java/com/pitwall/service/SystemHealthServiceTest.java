package com.pitwall.service;

import com.pitwall.cache.LocalKeyValueCache;
import com.pitwall.dto.CacheToggleResponse;
import com.pitwall.dto.CircuitBreakerHealth;
import com.pitwall.dto.SystemHealthStatus;
import com.pitwall.resilience.UpstreamCircuitBreaker;
import com.pitwall.state.CacheAvailability;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SystemHealthServiceTest {

    private UpstreamCircuitBreaker breaker;
    private CacheAvailability availability;
    private SystemHealthService service;

    @BeforeEach
    void setUp() {
        breaker = new UpstreamCircuitBreaker("health-test", 1, Duration.ofSeconds(30));
        availability = new CacheAvailability(true);
        service = new SystemHealthService(breaker, new LocalKeyValueCache(availability, 100), availability);
    }

    @Test
    void upWhenBreakerClosedAndCacheReady() {
        SystemHealthStatus status = service.getCurrentStatus();

        assertEquals("UP", status.getStatus());
        assertEquals("CLOSED", status.getCircuitBreaker());
        assertNull(status.getReason());
        assertEquals("healthy", service.getCircuitBreakerHealth().healthStatus());
    }

    @Test
    void downWhenBreakerOpen() {
        breaker.execute(() -> {
            throw new IllegalStateException("down");
        }, "fallback");

        SystemHealthStatus status = service.getCurrentStatus();

        assertEquals("DOWN", status.getStatus());
        assertEquals("CIRCUIT_BREAKER_OPEN", status.getReason());
        assertEquals("unhealthy", service.getCircuitBreakerHealth().healthStatus());
    }

    @Test
    void degradedWhenCacheUnreachable() {
        availability.markUnreachable();

        SystemHealthStatus status = service.getCurrentStatus();

        assertEquals("DEGRADED", status.getStatus());
        assertEquals("CACHE_UNAVAILABLE", status.getReason());
    }

    @Test
    void togglingCacheDisablesIt() {
        CacheToggleResponse response = service.toggleCache();

        assertFalse(response.enabled());
        assertEquals("ON -> OFF", response.message());
        assertEquals("CACHE_DISABLED", service.getCurrentStatus().getReason());
        assertFalse(service.getCacheStats().enabled());
    }

    @Test
    void resetReturnsClosedBreaker() {
        breaker.execute(() -> {
            throw new IllegalStateException("down");
        }, "fallback");

        CircuitBreakerHealth health = service.resetCircuitBreaker();

        assertEquals("healthy", health.healthStatus());
        assertEquals(0, health.stats().totalRequests());
    }
}
