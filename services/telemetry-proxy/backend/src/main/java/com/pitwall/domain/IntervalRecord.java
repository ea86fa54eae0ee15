package com.pitwall.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * gap / interval 은 숫자 또는 "+1 LAP" 같은 문자열로 내려오므로 String 으로 유지
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntervalRecord(
        @JsonProperty("meeting_key") Integer meetingKey,
        @JsonProperty("session_key") Integer sessionKey,
        @JsonProperty("driver_number") Integer driverNumber,
        @JsonProperty("date") String date,
        @JsonProperty("gap_to_leader") String gapToLeader,
        @JsonProperty("interval") String interval
) {}
