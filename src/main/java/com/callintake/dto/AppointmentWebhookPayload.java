package com.callintake.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AppointmentWebhookPayload(
        String caller,
        @JsonProperty("customer_name") String customerName,
        String summary,
        String transcript,
        String intent,
        @JsonProperty("callback_time") String callbackTime,
        String email
) {
}
