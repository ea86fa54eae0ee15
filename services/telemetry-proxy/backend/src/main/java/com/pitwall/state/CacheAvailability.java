package com.pitwall.state;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 캐시 사용 가능 여부 플래그
 *
 * - enabled   : 운영자 런타임 토글 (기본 ON)
 * - reachable : 저장소 연결 상태 (readiness probe / 명령 실패로 갱신)
 *
 * 모든 캐시 명령은 실행 전에 isReady() 를 확인한다.
 */
@Component
public class CacheAvailability {

    private final AtomicBoolean enabled;
    private final AtomicBoolean reachable = new AtomicBoolean(false);

    public CacheAvailability(@Value("${pitwall.cache.enabled:true}") boolean enabledInit) {
        this.enabled = new AtomicBoolean(enabledInit);
    }

    public boolean isReady() {
        return enabled.get() && reachable.get();
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    public boolean isReachable() {
        return reachable.get();
    }

    /**
     * @return 상태가 실제로 바뀐 경우 true (로그 중복 방지용)
     */
    public boolean markReachable() {
        return reachable.compareAndSet(false, true);
    }

    /**
     * @return 상태가 실제로 바뀐 경우 true
     */
    public boolean markUnreachable() {
        return reachable.compareAndSet(true, false);
    }

    public boolean toggleEnabled() {
        while (true) {
            boolean prev = enabled.get();
            boolean next = !prev;

            // 다른 스레드가 먼저 바꿨다면 최신 값으로 재시도
            if (enabled.compareAndSet(prev, next)) {
                return next;
            }
        }
    }
}
