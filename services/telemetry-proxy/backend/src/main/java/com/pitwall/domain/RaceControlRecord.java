package com.pitwall.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RaceControlRecord(
        @JsonProperty("meeting_key") Integer meetingKey,
        @JsonProperty("session_key") Integer sessionKey,
        @JsonProperty("date") String date,
        @JsonProperty("driver_number") Integer driverNumber,
        @JsonProperty("lap_number") Integer lapNumber,
        @JsonProperty("category") String category,
        @JsonProperty("flag") String flag,
        @JsonProperty("scope") String scope,
        @JsonProperty("sector") Integer sector,
        @JsonProperty("message") String message
) {}
