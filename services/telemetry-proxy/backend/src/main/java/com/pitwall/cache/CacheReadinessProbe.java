package com.pitwall.cache;

import com.pitwall.logging.LogEvent;
import com.pitwall.state.CacheAvailability;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Redis readiness probe
 *
 * - 주기적으로 PING 을 보내 CacheAvailability.reachable 갱신
 * - Redis 가 한 번도 뜨지 않아도 애플리케이션은 always-miss 모드로 계속 동작
 * - 상태가 바뀌는 시점에만 로그 기록 (Redis 미기동 시 로그 폭주 방지)
 */
@Slf4j
@RequiredArgsConstructor
public class CacheReadinessProbe {

    private final RedisKeyValueCache cache;
    private final CacheAvailability availability;

    private final AtomicBoolean firstProbe = new AtomicBoolean(true);

    @Scheduled(
            initialDelayString = "${pitwall.cache.probe-initial-delay-ms:0}",
            fixedDelayString = "${pitwall.cache.probe-interval-ms:5000}"
    )
    public void probe() {
        boolean alive;
        String cause = null;

        try {
            alive = cache.ping();
        } catch (RuntimeException e) {
            alive = false;
            cause = e.getMessage();
        }

        if (alive) {
            firstProbe.set(false);
            if (availability.markReachable()) {
                log.info("event={} backend={}", LogEvent.CACHE_READY, RedisKeyValueCache.BACKEND);
            }
            return;
        }

        boolean first = firstProbe.getAndSet(false);

        if (availability.markUnreachable() || first) {
            log.warn(
                    "event={} backend={} cause={}",
                    LogEvent.CACHE_UNAVAILABLE,
                    RedisKeyValueCache.BACKEND,
                    cause
            );
        }
    }
}
