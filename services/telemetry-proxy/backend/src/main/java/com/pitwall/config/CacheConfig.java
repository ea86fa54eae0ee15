package com.pitwall.config;

import com.pitwall.cache.CacheReadinessProbe;
import com.pitwall.cache.KeyValueCache;
import com.pitwall.cache.LocalKeyValueCache;
import com.pitwall.cache.RedisKeyValueCache;
import com.pitwall.state.CacheAvailability;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * KeyValueCache 구성
 *
 * pitwall.cache.backend
 * - redis (기본) : 공유 캐시, PING readiness probe 로 연결 상태 추적
 * - local        : 단일 인스턴스 Caffeine 캐시
 *
 * 어느 쪽이든 저장소 장애는 always-miss 로 처리되고 애플리케이션은 계속 동작한다.
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Value("${pitwall.cache.key-prefix:pitwall:}")
    private String keyPrefix;

    @Value("${pitwall.cache.local.max-size:10000}")
    private long localMaxSize;

    @Bean
    @ConditionalOnProperty(name = "pitwall.cache.backend", havingValue = "redis", matchIfMissing = true)
    public RedisKeyValueCache redisKeyValueCache(StringRedisTemplate redisTemplate,
                                                 CacheAvailability cacheAvailability) {
        log.info("Redis cache configured: keyPrefix={}", keyPrefix);
        return new RedisKeyValueCache(redisTemplate, cacheAvailability, keyPrefix);
    }

    @Bean
    @ConditionalOnProperty(name = "pitwall.cache.backend", havingValue = "redis", matchIfMissing = true)
    public CacheReadinessProbe cacheReadinessProbe(RedisKeyValueCache redisKeyValueCache,
                                                   CacheAvailability cacheAvailability) {
        return new CacheReadinessProbe(redisKeyValueCache, cacheAvailability);
    }

    @Bean
    @ConditionalOnProperty(name = "pitwall.cache.backend", havingValue = "local")
    public KeyValueCache localKeyValueCache(CacheAvailability cacheAvailability) {
        return new LocalKeyValueCache(cacheAvailability, localMaxSize);
    }
}
