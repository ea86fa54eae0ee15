package com.pitwall.controller;

import com.pitwall.cache.CacheStats;
import com.pitwall.dto.CacheToggleResponse;
import com.pitwall.dto.CircuitBreakerHealth;
import com.pitwall.dto.SystemHealthStatus;
import com.pitwall.resilience.CircuitBreakerState;
import com.pitwall.resilience.CircuitBreakerStats;
import com.pitwall.service.SystemHealthService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SystemHealthService systemHealthService;

    @Test
    void healthyServiceReturns200() throws Exception {
        when(systemHealthService.getCurrentStatus())
                .thenReturn(new SystemHealthStatus("UP", "CLOSED", true, null));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("UP"))
                .andExpect(jsonPath("$.data.circuitBreaker").value("CLOSED"));
    }

    @Test
    void openBreakerReturns503() throws Exception {
        when(systemHealthService.getCurrentStatus())
                .thenReturn(new SystemHealthStatus("DOWN", "OPEN", true, "CIRCUIT_BREAKER_OPEN"));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.httpCode").value(503))
                .andExpect(jsonPath("$.data.reason").value("CIRCUIT_BREAKER_OPEN"));
    }

    @Test
    void circuitBreakerStatsIncludeHealthLabel() throws Exception {
        when(systemHealthService.getCircuitBreakerHealth()).thenReturn(new CircuitBreakerHealth(
                new CircuitBreakerStats("openf1", CircuitBreakerState.HALF_OPEN, 5, null,
                        12, 7, 5, 0, 5, Duration.ofSeconds(30)),
                "recovering"
        ));

        mockMvc.perform(get("/api/v1/health/circuit-breaker"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.healthStatus").value("recovering"))
                .andExpect(jsonPath("$.data.stats.state").value("HALF_OPEN"))
                .andExpect(jsonPath("$.data.stats.totalRequests").value(12));
    }

    @Test
    void resetDelegatesToService() throws Exception {
        when(systemHealthService.resetCircuitBreaker()).thenReturn(new CircuitBreakerHealth(
                new CircuitBreakerStats("openf1", CircuitBreakerState.CLOSED, 0, null,
                        0, 0, 0, 0, 5, Duration.ofSeconds(30)),
                "healthy"
        ));

        mockMvc.perform(post("/api/v1/health/circuit-breaker/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.healthStatus").value("healthy"));

        verify(systemHealthService).resetCircuitBreaker();
    }

    @Test
    void cacheStatsAndToggle() throws Exception {
        when(systemHealthService.getCacheStats()).thenReturn(new CacheStats("redis", true, false, null));
        when(systemHealthService.toggleCache()).thenReturn(new CacheToggleResponse(false, "ON -> OFF"));

        mockMvc.perform(get("/api/v1/health/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.backend").value("redis"))
                .andExpect(jsonPath("$.data.reachable").value(false));

        mockMvc.perform(post("/api/v1/health/cache/toggle"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.enabled").value(false))
                .andExpect(jsonPath("$.data.message").value("ON -> OFF"));
    }
}
