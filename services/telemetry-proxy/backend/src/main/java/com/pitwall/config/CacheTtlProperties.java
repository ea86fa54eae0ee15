package com.pitwall.config;

import com.pitwall.domain.DataCategory;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 카테고리별 캐시 TTL 정책
 *
 * pitwall.cache.ttl.<category> 로 개별 override, 미설정 카테고리는 기본 테이블,
 * 기본 테이블에도 없으면 default-ttl 사용.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pitwall.cache")
public class CacheTtlProperties {

    private static final Map<DataCategory, Duration> DEFAULTS;

    static {
        Map<DataCategory, Duration> defaults = new EnumMap<>(DataCategory.class);
        defaults.put(DataCategory.SESSIONS, Duration.ofHours(1));
        defaults.put(DataCategory.DRIVERS, Duration.ofMinutes(30));
        defaults.put(DataCategory.LAPS, Duration.ofMinutes(15));
        defaults.put(DataCategory.CAR_DATA, Duration.ofMinutes(10));
        defaults.put(DataCategory.INTERVALS, Duration.ofMinutes(5));
        defaults.put(DataCategory.RACE_CONTROL, Duration.ofMinutes(10));
        defaults.put(DataCategory.STINTS, Duration.ofMinutes(30));
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private Map<DataCategory, Duration> ttl = new EnumMap<>(DataCategory.class);

    private Duration defaultTtl = Duration.ofMinutes(5);

    public Duration ttlFor(DataCategory category) {
        Duration configured = ttl.get(category);
        if (configured != null) {
            return configured;
        }
        return DEFAULTS.getOrDefault(category, defaultTtl);
    }
}
