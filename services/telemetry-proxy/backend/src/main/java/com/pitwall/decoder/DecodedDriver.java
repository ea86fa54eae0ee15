package com.pitwall.decoder;

public record DecodedDriver(
        Integer number,
        String name,
        String fullName,
        String team,
        String teamColour,
        String countryCode,
        String headshotUrl,
        Integer sessionKey,
        Integer meetingKey
) {}
