package com.pitwall.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CarDataRecord(
        @JsonProperty("meeting_key") Integer meetingKey,
        @JsonProperty("session_key") Integer sessionKey,
        @JsonProperty("driver_number") Integer driverNumber,
        @JsonProperty("date") String date,
        @JsonProperty("brake") Integer brake,
        @JsonProperty("throttle") Integer throttle,
        @JsonProperty("drs") Integer drs,
        @JsonProperty("n_gear") Integer gear,
        @JsonProperty("rpm") Integer rpm,
        @JsonProperty("speed") Integer speed
) {}
