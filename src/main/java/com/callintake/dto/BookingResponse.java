package com.callintake.dto;

import com.callintake.domain.model.AppointmentResult;
import com.callintake.domain.model.ChannelOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record BookingResponse(
        String status,
        String message,
        @JsonProperty("event_id") String eventId,
        @JsonProperty("scheduled_start") String scheduledStart,
        ChannelSummary data,
        Map<String, ChannelOutcome> channels
) {
    public static BookingResponse from(AppointmentResult result) {
        return new BookingResponse(
                "ok",
                "Booking processed",
                result.calendarEventId(),
                AppointmentWebhookResponse.formatTime(result.intent().scheduledAt()),
                ChannelSummary.from(result),
                result.outcomes()
        );
    }
}
