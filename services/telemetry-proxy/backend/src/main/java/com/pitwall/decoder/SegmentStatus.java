package com.pitwall.decoder;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * Mini-sector segment codes as published by the timing feed.
 */
@Getter
public enum SegmentStatus {

    NONE(0, "none", "none", "not available", SectorPerformance.NEUTRAL),
    YELLOW(2048, "yellow", "yellow", "yellow sector", SectorPerformance.NEUTRAL),
    BEST(2049, "best", "green", "green sector", SectorPerformance.BEST),
    PERSONAL_BEST(2051, "personal_best", "purple", "purple sector", SectorPerformance.PERSONAL_BEST),
    PIT(2064, "pit", "pit", "pitlane", SectorPerformance.PIT),
    UNKNOWN(-1, "unknown", "unknown", "unknown segment", SectorPerformance.NEUTRAL);

    private final int code;
    private final String label;
    private final String colour;
    private final String meaning;
    private final SectorPerformance performance;

    SegmentStatus(int code, String label, String colour, String meaning, SectorPerformance performance) {
        this.code = code;
        this.label = label;
        this.colour = colour;
        this.meaning = meaning;
        this.performance = performance;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    static SegmentStatus fromCode(Integer code) {
        if (code == null) {
            return UNKNOWN;
        }
        for (SegmentStatus status : values()) {
            if (status != UNKNOWN && status.code == code) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
