package com.pitwall.cache;

import com.pitwall.domain.DataCategory;
import com.pitwall.domain.FetchParams;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 캐시 키 생성 규칙
 *
 * session 단위 데이터:
 *   session:{sessionKey}:[driver:{n}:][lap:{n}:]{category}[:{fingerprint}]
 *   예) session:9158:driver:1:telemetry
 *       session:9158:driver:44:lap:12:laps
 *       session:9158:intervals:date=2023-09-16T13%3A00%3A00
 *
 * session 이 없는 조회:
 *   {category}:{fingerprint | all}
 *   예) sessions:country_name=Italy&year=2023
 *
 * fingerprint = 나머지 파라미터를 이름순 정렬 후 name=value 를 '&' 로 연결 (URL 인코딩)
 * session:{sessionKey}: prefix 로 세션 전체를 한 번에 무효화할 수 있다.
 */
public final class CacheKeyFactory {

    private static final String SESSION = "session";
    private static final String DRIVER = "driver";
    private static final String LAP = "lap";
    private static final String ALL = "all";

    private CacheKeyFactory() {
    }

    public static String build(DataCategory category, FetchParams params) {
        if (params.isSessionScoped()) {
            return sessionScopedKey(category, params);
        }

        // session 이 없으면 driver / lap 도 fingerprint 에 포함
        SortedMap<String, String> all = new TreeMap<>(params.getFilters());
        if (params.getDriverNumber() != null) {
            all.put(FetchParams.DRIVER_NUMBER, params.getDriverNumber().toString());
        }
        if (params.getLapNumber() != null) {
            all.put(FetchParams.LAP_NUMBER, params.getLapNumber().toString());
        }

        String fingerprint = fingerprint(all);
        return category.getCacheSegment() + ":" + (fingerprint.isEmpty() ? ALL : fingerprint);
    }

    /**
     * 세션 단위 무효화용 prefix
     */
    public static String sessionPrefix(int sessionKey) {
        return SESSION + ":" + sessionKey + ":";
    }

    private static String sessionScopedKey(DataCategory category, FetchParams params) {
        StringBuilder key = new StringBuilder(sessionPrefix(params.getSessionKey()));

        if (params.getDriverNumber() != null) {
            key.append(DRIVER).append(':').append(params.getDriverNumber()).append(':');
        }
        if (params.getLapNumber() != null) {
            key.append(LAP).append(':').append(params.getLapNumber()).append(':');
        }

        key.append(category.getCacheSegment());

        String fingerprint = fingerprint(params.getFilters());
        if (!fingerprint.isEmpty()) {
            key.append(':').append(fingerprint);
        }
        return key.toString();
    }

    private static String fingerprint(SortedMap<String, String> params) {
        return params.entrySet().stream()
                .map(CacheKeyFactory::encode)
                .collect(Collectors.joining("&"));
    }

    private static String encode(Map.Entry<String, String> entry) {
        return URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                + "="
                + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8);
    }
}
