package com.callintake.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BookingRequest(
        String name,
        String phone,
        String address,
        @JsonProperty("preferred_date") String preferredDate,
        @JsonProperty("preferred_time") String preferredTime,
        String email,
        String notes
) {
}
