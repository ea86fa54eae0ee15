package com.pitwall.decoder;

/**
 * @param value 원본 segment 코드 (null 가능)
 */
public record DecodedSegment(
        Integer value,
        String colour,
        String meaning,
        SectorPerformance performance
) {}
