package com.pitwall.decoder;

import java.util.List;

public record DecodedSector(
        int index,                  // 1..3
        Double duration,
        List<DecodedSegment> segments,
        SectorPerformance performance
) {}
