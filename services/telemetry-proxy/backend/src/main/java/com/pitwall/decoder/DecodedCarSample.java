package com.pitwall.decoder;

public record DecodedCarSample(
        Integer meetingKey,
        Integer sessionKey,
        Integer driverNumber,
        String timestamp,
        Integer speed,
        Integer rpm,
        Integer gear,
        Integer throttle,
        Integer brake,
        Integer drsValue,
        DrsState drs
) {}
