package com.pitwall.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

public class CacheMetrics {

    // 캐시 적중 횟수 누적 카운터
    private final Counter cacheHit;

    // 캐시 미적중 횟수 누적 카운터 (저장소 장애로 인한 miss 포함)
    private final Counter cacheMiss;

    // Upstream 실패 후 빈 결과로 대체된 횟수
    private final Counter upstreamFallback;

    public CacheMetrics(MeterRegistry registry) {
        this.cacheHit = Counter.builder("cache_hit_total")
                .description("Telemetry cache hit count")
                .register(registry);
        this.cacheMiss = Counter.builder("cache_miss_total")
                .description("Telemetry cache miss count")
                .register(registry);
        this.upstreamFallback = Counter.builder("upstream_fallback_total")
                .description("Upstream calls answered with the empty fallback")
                .register(registry);
    }

    public void incrementHit() {
        cacheHit.increment();
    }

    public void incrementMiss() {
        cacheMiss.increment();
    }

    public void incrementFallback() {
        upstreamFallback.increment();
    }

    public double getHitCount() {
        return cacheHit.count();
    }

    public double getMissCount() {
        return cacheMiss.count();
    }

    public double getFallbackCount() {
        return upstreamFallback.count();
    }
}
