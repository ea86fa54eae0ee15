package com.pitwall.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DriverRecord(
        @JsonProperty("meeting_key") Integer meetingKey,
        @JsonProperty("session_key") Integer sessionKey,
        @JsonProperty("driver_number") Integer driverNumber,
        @JsonProperty("full_name") String fullName,
        @JsonProperty("name_acronym") String nameAcronym,
        @JsonProperty("team_name") String teamName,
        @JsonProperty("team_colour") String teamColour,
        @JsonProperty("country_code") String countryCode,
        @JsonProperty("headshot_url") String headshotUrl
) {}
