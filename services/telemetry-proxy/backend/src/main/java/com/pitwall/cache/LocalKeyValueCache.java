package com.pitwall.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.pitwall.logging.LogEvent;
import com.pitwall.state.CacheAvailability;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 단일 인스턴스용 in-process KeyValueCache (Caffeine)
 *
 * - entry 마다 TTL 이 다르므로 variable expiry 사용
 * - 프로세스 내부 저장소라 항상 reachable, 운영자 토글(enabled)만 반영
 */
@Slf4j
public class LocalKeyValueCache implements KeyValueCache {

    static final String BACKEND = "local";

    private final Cache<String, Entry> store;
    private final CacheAvailability availability;

    public LocalKeyValueCache(CacheAvailability availability, long maximumSize) {
        this(availability, maximumSize, Ticker.systemTicker());
    }

    public LocalKeyValueCache(CacheAvailability availability, long maximumSize, Ticker ticker) {
        this.availability = Objects.requireNonNull(availability, "availability must not be null");
        this.store = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new TtlExpiry())
                .ticker(ticker)
                .build();

        availability.markReachable();

        log.info("Local cache configured: maxSize={}", maximumSize);
    }

    @Override
    public Optional<String> get(String key) {
        if (!availability.isReady()) {
            return Optional.empty();
        }

        Entry entry = store.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (!availability.isReady() || ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        store.put(key, new Entry(value, ttl));
    }

    @Override
    public void delete(String key) {
        if (!availability.isReady()) {
            return;
        }
        store.invalidate(key);
    }

    @Override
    public long deletePrefix(String prefix) {
        if (!availability.isReady()) {
            return 0;
        }

        long deleted = 0;
        for (String key : List.copyOf(store.asMap().keySet())) {
            if (key.startsWith(prefix) && store.asMap().remove(key) != null) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public boolean exists(String key) {
        return get(key).isPresent();
    }

    @Override
    public long flush() {
        long deleted = deletePrefix("");
        log.info("event={} backend={} keys={}", LogEvent.CACHE_FLUSHED, BACKEND, deleted);
        return deleted;
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(
                BACKEND,
                availability.isEnabled(),
                availability.isReachable(),
                store.estimatedSize()
        );
    }

    private record Entry(String value, Duration ttl) {
    }

    /**
     * 쓰기 시점의 TTL 로 만료, 읽기는 만료 시간에 영향 없음
     */
    private static final class TtlExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
