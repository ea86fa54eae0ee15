package com.pitwall.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL 기반 문자열 key-value 저장소
 *
 * 저장소에 연결할 수 없는 상태여도 호출자에게 예외를 던지지 않는다.
 * - get    : empty (cache miss 와 구분되지 않음)
 * - exists : false
 * - set / delete / deletePrefix / flush : no-op
 *
 * 값의 직렬화 형식은 호출자만 알고 있다.
 */
public interface KeyValueCache {

    Optional<String> get(String key);

    /**
     * ttl 이 0 이하이면 저장하지 않는다
     */
    void set(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * prefix 로 시작하는 모든 key 삭제
     *
     * @return 삭제된 key 개수 (저장소 사용 불가 시 0)
     */
    long deletePrefix(String prefix);

    boolean exists(String key);

    /**
     * 이 캐시 namespace 전체 삭제
     */
    long flush();

    CacheStats stats();
}
