package com.pitwall.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StintRecord(
        @JsonProperty("meeting_key") Integer meetingKey,
        @JsonProperty("session_key") Integer sessionKey,
        @JsonProperty("driver_number") Integer driverNumber,
        @JsonProperty("stint_number") Integer stintNumber,
        @JsonProperty("lap_start") Integer lapStart,
        @JsonProperty("lap_end") Integer lapEnd,
        @JsonProperty("compound") String compound,
        @JsonProperty("tyre_age_at_start") Integer tyreAgeAtStart
) {}
