package com.pitwall.cache;

/**
 * @param keyCount 저장소 사용 불가 시 null
 */
public record CacheStats(
        String backend,
        boolean enabled,
        boolean reachable,
        Long keyCount
) {

    public boolean ready() {
        return enabled && reachable;
    }
}
