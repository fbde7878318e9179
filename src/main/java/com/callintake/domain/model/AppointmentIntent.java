package com.callintake.domain.model;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Validated, normalized form of an inbound appointment request.
 *
 * <p>{@code callerPhone} keeps the caller's original formatting; only its digit
 * count was checked. {@code customerEmail}, {@code transcript}, {@code intentLabel},
 * {@code location} and {@code duration} may be {@code null}. A {@code null}
 * duration means the configured default applies.
 */
public record AppointmentIntent(
        String callerPhone,
        String customerName,
        String summary,
        String transcript,
        String intentLabel,
        OffsetDateTime scheduledAt,
        String customerEmail,
        String location,
        Duration duration
) {
    public static final String DEFAULT_CUSTOMER_NAME = "Customer";
    public static final String DEFAULT_SUMMARY = "Appointment scheduled via phone";

    public AppointmentIntent {
        Objects.requireNonNull(callerPhone, "callerPhone");
        Objects.requireNonNull(scheduledAt, "scheduledAt");
        customerName = customerName == null || customerName.isBlank() ? DEFAULT_CUSTOMER_NAME : customerName;
        summary = summary == null || summary.isBlank() ? DEFAULT_SUMMARY : summary;
    }

    public boolean hasEmail() {
        return customerEmail != null && !customerEmail.isBlank();
    }

    public boolean hasLocation() {
        return location != null && !location.isBlank();
    }
}
