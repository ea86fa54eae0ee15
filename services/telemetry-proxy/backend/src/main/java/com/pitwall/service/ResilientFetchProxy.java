package com.pitwall.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pitwall.cache.CacheKeyFactory;
import com.pitwall.cache.KeyValueCache;
import com.pitwall.client.UpstreamClient;
import com.pitwall.config.CacheTtlProperties;
import com.pitwall.domain.CarDataRecord;
import com.pitwall.domain.DataCategory;
import com.pitwall.domain.DriverRecord;
import com.pitwall.domain.FetchParams;
import com.pitwall.domain.IntervalRecord;
import com.pitwall.domain.LapRecord;
import com.pitwall.domain.RaceControlRecord;
import com.pitwall.domain.SessionRecord;
import com.pitwall.domain.StintRecord;
import com.pitwall.logging.LogEvent;
import com.pitwall.observability.CacheMetrics;
import com.pitwall.resilience.UpstreamCircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Cache-aside fetch in front of the upstream API
 *
 * 1. key = CacheKeyFactory.build(category, params)
 * 2. cache hit  → 역직렬화 후 반환 (upstream / breaker 미사용)
 * 3. cache miss → breaker.execute(upstream 호출, 빈 리스트 fallback)
 * 4. 결과(데이터 또는 빈 fallback)를 카테고리 TTL 로 저장 후 반환
 *
 * 연속 실패가 임계값에 도달하기 전의 upstream 실패는 호출자에게 전파된다.
 * 동일 key 에 대한 동시 miss 는 병합하지 않는다 (각자 upstream 호출).
 */
@Slf4j
@RequiredArgsConstructor
public class ResilientFetchProxy {

    private final UpstreamClient upstreamClient;
    private final UpstreamCircuitBreaker circuitBreaker;
    private final KeyValueCache cache;
    private final CacheTtlProperties ttlPolicy;
    private final ObjectMapper objectMapper;
    private final CacheMetrics cacheMetrics;

    /**
     * 카테고리 기본 레코드 타입으로 조회
     */
    public List<?> fetch(DataCategory category, FetchParams params) {
        return fetch(category, params, category.getRecordType());
    }

    public <T> List<T> fetch(DataCategory category, FetchParams params, Class<T> recordType) {
        if (!recordType.isAssignableFrom(category.getRecordType())) {
            throw new IllegalArgumentException(
                    category + " records are " + category.getRecordType().getSimpleName()
                            + ", not " + recordType.getSimpleName());
        }

        String key = CacheKeyFactory.build(category, params);
        JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, recordType);

        Optional<List<T>> cached = readCached(key, listType);
        if (cached.isPresent()) {
            cacheMetrics.incrementHit();
            log.debug("Cache HIT: {}", key);
            return cached.get();
        }

        cacheMetrics.incrementMiss();
        log.debug("Cache MISS: {}", key);

        // identity 비교로 fallback 여부 판별
        List<T> fallback = Collections.unmodifiableList(new ArrayList<>(0));
        List<T> result = circuitBreaker.execute(
                () -> upstreamClient.call(category, params, recordType),
                fallback
        );

        if (result == fallback) {
            cacheMetrics.incrementFallback();
        }

        write(key, result, ttlPolicy.ttlFor(category));
        return result;
    }

    public List<SessionRecord> fetchSessions(FetchParams params) {
        return fetch(DataCategory.SESSIONS, params, SessionRecord.class);
    }

    public List<DriverRecord> fetchDrivers(FetchParams params) {
        return fetch(DataCategory.DRIVERS, params, DriverRecord.class);
    }

    public List<LapRecord> fetchLaps(FetchParams params) {
        return fetch(DataCategory.LAPS, params, LapRecord.class);
    }

    public List<CarDataRecord> fetchCarData(FetchParams params) {
        return fetch(DataCategory.CAR_DATA, params, CarDataRecord.class);
    }

    public List<IntervalRecord> fetchIntervals(FetchParams params) {
        return fetch(DataCategory.INTERVALS, params, IntervalRecord.class);
    }

    public List<RaceControlRecord> fetchRaceControl(FetchParams params) {
        return fetch(DataCategory.RACE_CONTROL, params, RaceControlRecord.class);
    }

    public List<StintRecord> fetchStints(FetchParams params) {
        return fetch(DataCategory.STINTS, params, StintRecord.class);
    }

    /**
     * 세션 단위 캐시 무효화
     *
     * @return 삭제된 key 개수
     */
    public long invalidateSession(int sessionKey) {
        return cache.deletePrefix(CacheKeyFactory.sessionPrefix(sessionKey));
    }

    public long invalidateAll() {
        return cache.flush();
    }

    private <T> Optional<List<T>> readCached(String key, JavaType listType) {
        Optional<String> payload = cache.get(key);
        if (payload.isEmpty()) {
            return Optional.empty();
        }

        try {
            List<T> records = objectMapper.readValue(payload.get(), listType);
            return Optional.ofNullable(records);
        } catch (JsonProcessingException e) {
            // 손상된 payload 는 miss 로 취급, 이후 upstream 결과로 덮어쓴다
            log.warn("event={} key={} cause={}", LogEvent.CACHE_CORRUPTED, key, e.getOriginalMessage());
            cache.delete(key);
            return Optional.empty();
        }
    }

    private void write(String key, List<?> records, Duration ttl) {
        try {
            cache.set(key, objectMapper.writeValueAsString(records), ttl);
        } catch (JsonProcessingException e) {
            log.warn("Cache write skipped: key={} cause={}", key, e.getOriginalMessage());
        }
    }
}
