package com.pitwall.dto;

import com.pitwall.resilience.CircuitBreakerStats;

/**
 * @param healthStatus healthy / recovering / unhealthy
 */
public record CircuitBreakerHealth(
        CircuitBreakerStats stats,
        String healthStatus
) {}
