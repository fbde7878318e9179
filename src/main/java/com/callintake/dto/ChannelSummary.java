package com.callintake.dto;

import com.callintake.domain.model.AppointmentResult;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Flat per-channel flags shared by the webhook and booking responses.
 */
public record ChannelSummary(
        @JsonProperty("calendar_created") boolean calendarCreated,
        @JsonProperty("sms_sent") boolean smsSent,
        @JsonProperty("email_sent") boolean emailSent,
        @JsonProperty("calendar_event_id") String calendarEventId,
        @JsonProperty("calendar_link") String calendarLink
) {
    public static ChannelSummary from(AppointmentResult result) {
        return new ChannelSummary(
                result.calendar().succeeded(),
                result.sms().succeeded(),
                result.email().succeeded(),
                result.calendarEventId(),
                result.calendarLink()
        );
    }
}
