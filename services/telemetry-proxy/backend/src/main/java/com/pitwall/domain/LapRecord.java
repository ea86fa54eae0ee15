package com.pitwall.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * lapDuration == null 이면 완주하지 못한 랩
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LapRecord(
        @JsonProperty("meeting_key") Integer meetingKey,
        @JsonProperty("session_key") Integer sessionKey,
        @JsonProperty("driver_number") Integer driverNumber,
        @JsonProperty("lap_number") Integer lapNumber,
        @JsonProperty("date_start") String dateStart,
        @JsonProperty("duration_sector_1") Double durationSector1,
        @JsonProperty("duration_sector_2") Double durationSector2,
        @JsonProperty("duration_sector_3") Double durationSector3,
        @JsonProperty("lap_duration") Double lapDuration,
        @JsonProperty("is_pit_out_lap") Boolean pitOutLap,
        @JsonProperty("i1_speed") Integer i1Speed,
        @JsonProperty("i2_speed") Integer i2Speed,
        @JsonProperty("st_speed") Integer stSpeed,
        @JsonProperty("segments_sector_1") List<Integer> segmentsSector1,
        @JsonProperty("segments_sector_2") List<Integer> segmentsSector2,
        @JsonProperty("segments_sector_3") List<Integer> segmentsSector3
) {}
