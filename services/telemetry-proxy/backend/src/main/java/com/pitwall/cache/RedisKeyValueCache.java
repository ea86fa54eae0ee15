package com.pitwall.cache;

import com.pitwall.logging.LogEvent;
import com.pitwall.state.CacheAvailability;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Redis 기반 KeyValueCache
 *
 * - 모든 명령 전에 CacheAvailability.isReady() 확인 → 준비 안 됨이면 miss / no-op
 * - 명령 도중 Redis 계층 오류가 나면 reachable=false 로 전환하고 miss / no-op 으로 처리
 *   (재연결 확인은 CacheReadinessProbe 가 담당)
 * - 모든 key 에 namespace prefix 부여
 */
@Slf4j
public class RedisKeyValueCache implements KeyValueCache {

    static final String BACKEND = "redis";

    private static final int SCAN_BATCH_SIZE = 500;

    private final StringRedisTemplate redisTemplate;
    private final CacheAvailability availability;
    private final String namespace;

    public RedisKeyValueCache(StringRedisTemplate redisTemplate,
                              CacheAvailability availability,
                              String namespace) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate must not be null");
        this.availability = Objects.requireNonNull(availability, "availability must not be null");
        this.namespace = namespace == null ? "" : namespace;
    }

    @Override
    public Optional<String> get(String key) {
        if (!availability.isReady()) {
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(namespaced(key)));
        } catch (DataAccessException e) {
            degrade("get", key, e);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (!availability.isReady() || ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }

        try {
            redisTemplate.opsForValue().set(namespaced(key), value, ttl);
            log.debug("Cache SET: {} (ttl={}s)", key, ttl.toSeconds());
        } catch (DataAccessException e) {
            degrade("set", key, e);
        }
    }

    @Override
    public void delete(String key) {
        if (!availability.isReady()) {
            return;
        }

        try {
            redisTemplate.delete(namespaced(key));
        } catch (DataAccessException e) {
            degrade("delete", key, e);
        }
    }

    @Override
    public long deletePrefix(String prefix) {
        if (!availability.isReady()) {
            return 0;
        }

        ScanOptions options = scanOptions(prefix);

        long deleted = 0;
        List<String> batch = new ArrayList<>(SCAN_BATCH_SIZE);

        // KEYS 대신 SCAN 으로 조금씩 순회 (Redis 블로킹 방지)
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            while (cursor.hasNext()) {
                batch.add(cursor.next());

                if (batch.size() >= SCAN_BATCH_SIZE) {
                    deleted += deleteBatch(batch);
                    batch.clear();
                }
            }
            deleted += deleteBatch(batch);
        } catch (DataAccessException e) {
            degrade("deletePrefix", prefix, e);
            return deleted;
        }

        log.debug("Cache DEL prefix: {} ({} keys)", prefix, deleted);
        return deleted;
    }

    @Override
    public boolean exists(String key) {
        if (!availability.isReady()) {
            return false;
        }

        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(namespaced(key)));
        } catch (DataAccessException e) {
            degrade("exists", key, e);
            return false;
        }
    }

    /**
     * FLUSHALL 대신 namespace 범위만 삭제
     */
    @Override
    public long flush() {
        long deleted = deletePrefix("");
        log.info("event={} backend={} keys={}", LogEvent.CACHE_FLUSHED, BACKEND, deleted);
        return deleted;
    }

    /**
     * keyCount 는 DB 전체가 아니라 이 namespace 의 key 수 (SCAN 으로 집계)
     */
    @Override
    public CacheStats stats() {
        Long keyCount = null;

        if (availability.isReady()) {
            try (Cursor<String> cursor = redisTemplate.scan(scanOptions(""))) {
                long count = 0;
                while (cursor.hasNext()) {
                    cursor.next();
                    count++;
                }
                keyCount = count;
            } catch (DataAccessException e) {
                degrade("stats", "*", e);
            }
        }

        return new CacheStats(
                BACKEND,
                availability.isEnabled(),
                availability.isReachable(),
                keyCount
        );
    }

    /**
     * Redis PING
     *
     * @return 응답이 PONG 이면 true
     */
    public boolean ping() {
        String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
        return "PONG".equalsIgnoreCase(reply);
    }

    private long deleteBatch(List<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        Long count = redisTemplate.delete(keys);
        return count == null ? 0 : count;
    }

    private void degrade(String operation, String key, DataAccessException e) {
        // 전환 시점에 한 번만 WARN, 이후에는 readiness 플래그가 명령 자체를 건너뛴다
        if (availability.markUnreachable()) {
            log.warn(
                    "event={} backend={} operation={} key={} cause={}",
                    LogEvent.CACHE_UNAVAILABLE,
                    BACKEND,
                    operation,
                    key,
                    e.getMessage()
            );
        }
    }

    private ScanOptions scanOptions(String prefix) {
        return ScanOptions.scanOptions()
                .match(escapeGlob(namespaced(prefix)) + "*")
                .count(SCAN_BATCH_SIZE)
                .build();
    }

    private String namespaced(String key) {
        return namespace + key;
    }

    private static String escapeGlob(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
