package com.pitwall.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pitwall.cache.KeyValueCache;
import com.pitwall.client.UpstreamClient;
import com.pitwall.logging.MdcTaskDecorator;
import com.pitwall.observability.CacheMetrics;
import com.pitwall.resilience.UpstreamCircuitBreaker;
import com.pitwall.service.PreloadOrchestrator;
import com.pitwall.service.ResilientFetchProxy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Cache-aside fetch 계층 조립
 */
@Configuration
public class FetchConfig {

    @Bean
    public ResilientFetchProxy resilientFetchProxy(UpstreamClient upstreamClient,
                                                   UpstreamCircuitBreaker upstreamCircuitBreaker,
                                                   KeyValueCache keyValueCache,
                                                   CacheTtlProperties cacheTtlProperties,
                                                   ObjectMapper objectMapper,
                                                   CacheMetrics cacheMetrics) {
        return new ResilientFetchProxy(
                upstreamClient,
                upstreamCircuitBreaker,
                keyValueCache,
                cacheTtlProperties,
                objectMapper,
                cacheMetrics
        );
    }

    /**
     * preload 전용 bounded pool
     * queue 가 가득 차면 RejectedExecutionException → 해당 카테고리 실패로 기록
     */
    @Bean
    public ThreadPoolTaskExecutor preloadExecutor(PreloadProperties preloadProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(preloadProperties.getPoolSize());
        executor.setMaxPoolSize(preloadProperties.getPoolSize());
        executor.setQueueCapacity(preloadProperties.getQueueCapacity());
        executor.setThreadNamePrefix("preload-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public PreloadOrchestrator preloadOrchestrator(ResilientFetchProxy resilientFetchProxy,
                                                   ThreadPoolTaskExecutor preloadExecutor,
                                                   PreloadProperties preloadProperties) {
        return new PreloadOrchestrator(
                resilientFetchProxy,
                preloadExecutor,
                preloadProperties.getCategories(),
                preloadProperties.getTimeout()
        );
    }
}
