package com.pitwall.decoder;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 섹터 요약 등급. 선언 순서가 우선순위 (앞쪽이 높음).
 */
public enum SectorPerformance {

    PERSONAL_BEST("personal_best"),
    BEST("best"),
    PIT("pit"),
    NEUTRAL("neutral");

    private final String label;

    SectorPerformance(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean outranks(SectorPerformance other) {
        return ordinal() < other.ordinal();
    }
}
