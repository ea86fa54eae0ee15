package com.pitwall.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Upstream 조회 파라미터 (불변)
 *
 * - sessionKey / driverNumber / lapNumber 는 캐시 키 구조에 직접 반영
 * - 나머지 필터(date, country_name, category 등)는 이름순으로 정렬해 보관
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FetchParams {

    public static final String SESSION_KEY = "session_key";
    public static final String DRIVER_NUMBER = "driver_number";
    public static final String LAP_NUMBER = "lap_number";

    private static final FetchParams EMPTY = new Builder().build();

    private final Integer sessionKey;
    private final Integer driverNumber;
    private final Integer lapNumber;
    private final SortedMap<String, String> filters;

    private FetchParams(Builder builder) {
        this.sessionKey = builder.sessionKey;
        this.driverNumber = builder.driverNumber;
        this.lapNumber = builder.lapNumber;
        this.filters = Collections.unmodifiableSortedMap(new TreeMap<>(builder.filters));
    }

    public static FetchParams empty() {
        return EMPTY;
    }

    public static FetchParams forSession(int sessionKey) {
        return builder().sessionKey(sessionKey).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * HTTP 쿼리 파라미터(snake_case)로부터 생성
     *
     * @throws IllegalArgumentException session_key / driver_number / lap_number 가 정수가 아닌 경우
     */
    public static FetchParams fromQuery(Map<String, String> query) {
        Builder builder = builder();

        query.forEach((name, value) -> {
            switch (name) {
                case SESSION_KEY -> builder.sessionKey(parseNumber(name, value));
                case DRIVER_NUMBER -> builder.driverNumber(parseNumber(name, value));
                case LAP_NUMBER -> builder.lapNumber(parseNumber(name, value));
                default -> builder.filter(name, value);
            }
        });

        return builder.build();
    }

    public boolean isSessionScoped() {
        return sessionKey != null;
    }

    /**
     * Upstream 호출용 쿼리 맵 (null 값 제외)
     */
    public Map<String, String> toQueryMap() {
        Map<String, String> query = new LinkedHashMap<>();

        if (sessionKey != null) {
            query.put(SESSION_KEY, sessionKey.toString());
        }
        if (driverNumber != null) {
            query.put(DRIVER_NUMBER, driverNumber.toString());
        }
        if (lapNumber != null) {
            query.put(LAP_NUMBER, lapNumber.toString());
        }
        query.putAll(filters);

        return query;
    }

    private static Integer parseNumber(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value, e);
        }
    }

    public static final class Builder {

        private Integer sessionKey;
        private Integer driverNumber;
        private Integer lapNumber;
        private final Map<String, String> filters = new TreeMap<>();

        private Builder() {
        }

        public Builder sessionKey(Integer sessionKey) {
            this.sessionKey = sessionKey;
            return this;
        }

        public Builder driverNumber(Integer driverNumber) {
            this.driverNumber = driverNumber;
            return this;
        }

        public Builder lapNumber(Integer lapNumber) {
            this.lapNumber = lapNumber;
            return this;
        }

        /**
         * 빈 값은 무시 (쿼리에서 생략한 것과 동일하게 취급)
         */
        public Builder filter(String name, Object value) {
            if (name == null || name.isBlank() || value == null) {
                return this;
            }

            String text = value.toString();
            if (!text.isBlank()) {
                filters.put(name, text);
            }
            return this;
        }

        public FetchParams build() {
            return new FetchParams(this);
        }
    }
}
