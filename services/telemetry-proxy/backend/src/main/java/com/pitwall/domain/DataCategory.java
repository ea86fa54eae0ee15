package com.pitwall.domain;

import lombok.Getter;

import java.util.Locale;
import java.util.Optional;

/**
 * Upstream data categories.
 *
 * - path         : upstream endpoint ({@code GET <base>/<path>})
 * - cacheSegment : category part of the cache key
 * - recordType   : record shape returned for the category
 */
@Getter
public enum DataCategory {

    SESSIONS("sessions", "sessions", SessionRecord.class),
    DRIVERS("drivers", "drivers", DriverRecord.class),
    LAPS("laps", "laps", LapRecord.class),
    CAR_DATA("car_data", "telemetry", CarDataRecord.class),
    INTERVALS("intervals", "intervals", IntervalRecord.class),
    RACE_CONTROL("race_control", "race_control", RaceControlRecord.class),
    STINTS("stints", "stints", StintRecord.class);

    private final String path;
    private final String cacheSegment;
    private final Class<?> recordType;

    DataCategory(String path, String cacheSegment, Class<?> recordType) {
        this.path = path;
        this.cacheSegment = cacheSegment;
        this.recordType = recordType;
    }

    /**
     * "car_data", "car-data", "CAR_DATA" 모두 허용
     */
    public static Optional<DataCategory> fromPath(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }

        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');

        for (DataCategory category : values()) {
            if (category.path.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
