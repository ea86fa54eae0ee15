package com.pitwall.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pitwall.client.OpenF1Client;
import com.pitwall.client.UpstreamClient;
import com.pitwall.resilience.UpstreamCircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Upstream API 의존성 구성: transport + 의존성 전용 CircuitBreaker
 */
@Configuration
public class UpstreamClientConfig {

    public static final String OPENF1_CIRCUIT = "openf1";

    @Bean
    public UpstreamClient upstreamClient(
            ObjectMapper objectMapper,
            @Value("${pitwall.upstream.base-url:https://api.openf1.org/v1}") String baseUrl,
            @Value("${pitwall.upstream.connect-timeout:10s}") Duration connectTimeout,
            @Value("${pitwall.upstream.read-timeout:30s}") Duration readTimeout,
            @Value("${pitwall.upstream.call-timeout:30s}") Duration callTimeout
    ) {
        return new OpenF1Client(
                baseUrl,
                objectMapper,
                new OpenF1Client.Timeouts(connectTimeout, readTimeout, callTimeout)
        );
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    @Bean
    public UpstreamCircuitBreaker upstreamCircuitBreaker(
            CircuitBreakerRegistry circuitBreakerRegistry,
            @Value("${pitwall.circuit-breaker.failure-threshold:5}") int failureThreshold,
            @Value("${pitwall.circuit-breaker.recovery-interval:30s}") Duration recoveryInterval
    ) {
        return new UpstreamCircuitBreaker(
                circuitBreakerRegistry,
                OPENF1_CIRCUIT,
                failureThreshold,
                recoveryInterval
        );
    }
}
