package com.pitwall.config.observability;

import com.pitwall.observability.CacheMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 관측 메트릭 정의
 */
@Configuration
public class MetricsConfig {

    /**
     * 모든 메트릭에 공통 tag 부여
     * Grafana에서 서비스 단위 필터링 가능
     */
    @Bean
    MeterRegistryCustomizer<MeterRegistry> metricsCommonTags(
            @Value("${spring.application.name:telemetry-proxy}") String serviceName) {
        return registry -> registry.config()
                .commonTags("service", serviceName);
    }

    @Bean
    public CacheMetrics cacheMetrics(MeterRegistry registry) {
        return new CacheMetrics(registry);
    }

    /**
     * CircuitBreaker 상태 / 호출 결과 메트릭 (resilience4j_circuitbreaker_*)
     */
    @Bean
    public MeterBinder circuitBreakerMetrics(CircuitBreakerRegistry circuitBreakerRegistry) {
        return TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(circuitBreakerRegistry);
    }
}
