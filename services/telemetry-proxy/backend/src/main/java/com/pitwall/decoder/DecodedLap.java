package com.pitwall.decoder;

import java.util.List;

public record DecodedLap(
        Integer meetingKey,
        Integer sessionKey,
        Integer driverNumber,
        Integer lapNumber,
        String timestamp,
        Double lapTime,             // null 이면 DNF
        List<DecodedSector> sectors,
        Integer i1Speed,
        Integer i2Speed,
        Integer stSpeed,
        boolean pitOutLap,
        boolean pitLane,
        boolean didNotFinish
) {}
