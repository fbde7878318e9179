package com.callintake.dto;

import com.callintake.domain.model.AppointmentIntent;
import com.callintake.domain.model.AppointmentResult;
import com.callintake.domain.model.ChannelOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.Map;

public record AppointmentWebhookResponse(
        String status,
        String message,
        ChannelSummary data,
        Map<String, ChannelOutcome> channels,
        Customer customer,
        @JsonProperty("appointment_time") String appointmentTime
) {
    /**
     * Seconds always, fractional seconds only when present, numeric offset even for UTC.
     */
    public static final DateTimeFormatter APPOINTMENT_TIME_FMT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .appendOffset("+HH:MM", "+00:00")
            .toFormatter();

    public static AppointmentWebhookResponse from(AppointmentResult result) {
        AppointmentIntent intent = result.intent();
        return new AppointmentWebhookResponse(
                "success",
                "Appointment processed successfully",
                ChannelSummary.from(result),
                result.outcomes(),
                new Customer(intent.customerName(), intent.callerPhone(), intent.customerEmail()),
                formatTime(intent.scheduledAt())
        );
    }

    public static String formatTime(OffsetDateTime time) {
        return time.format(APPOINTMENT_TIME_FMT);
    }

    public record Customer(String name, String phone, String email) {
    }
}
