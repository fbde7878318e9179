package com.callintake.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Business rules shared by every channel: timezones, appointment length and the
 * per-channel time budget.
 *
 * @param defaultTimezone    zone assumed for timestamps that carry no UTC offset
 * @param displayTimezone    zone used when rendering times for humans; falls back to {@code defaultTimezone}
 * @param duration           length of an appointment booked through the voice webhook
 * @param bookingDuration    length of a visit booked through the direct booking endpoint
 * @param transcriptMaxChars transcript characters kept in the calendar description
 * @param businessName       name used to sign SMS and email confirmations
 * @param channelTimeout     upper bound for a single external call
 * @param executorThreads    size of the pool that runs channel calls
 */
@Validated
@ConfigurationProperties(prefix = "app.appointment")
public record AppointmentProperties(
        @NotNull @DefaultValue("America/New_York") ZoneId defaultTimezone,
        ZoneId displayTimezone,
        @NotNull @DefaultValue("30m") Duration duration,
        @NotNull @DefaultValue("60m") Duration bookingDuration,
        @Positive @DefaultValue("4000") int transcriptMaxChars,
        @DefaultValue("Maxi") String businessName,
        @NotNull @DefaultValue("20s") Duration channelTimeout,
        @Positive @DefaultValue("8") int executorThreads
) {
    public ZoneId safeDisplayTimezone() {
        return displayTimezone != null ? displayTimezone : defaultTimezone;
    }

    public String safeBusinessName() {
        return businessName != null && !businessName.isBlank() ? businessName : "Maxi";
    }
}
