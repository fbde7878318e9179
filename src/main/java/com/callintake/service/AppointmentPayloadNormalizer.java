package com.callintake.service;

import com.callintake.config.AppointmentProperties;
import com.callintake.domain.model.AppointmentIntent;
import com.callintake.dto.AppointmentWebhookPayload;
import com.callintake.dto.BookingRequest;
import com.callintake.exception.PayloadValidationException;
import com.callintake.util.TextNormalization;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.regex.Pattern;

/**
 * Turns raw request bodies into {@link AppointmentIntent}s.
 *
 * <p>Fields are checked in a fixed order and the first failure is reported. Only
 * the phone number and the appointment time (and a present but malformed email)
 * can fail; every other field falls back to a default.
 */
@Component
@RequiredArgsConstructor
public class AppointmentPayloadNormalizer {

    static final int MIN_PHONE_DIGITS = 10;
    static final String BOOKING_INTENT_LABEL = "home visit";

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s.]+$");
    private static final DateTimeFormatter BOOKING_TIME_FMT = DateTimeFormatter.ofPattern("H:mm");

    private final AppointmentProperties properties;

    public AppointmentIntent normalize(AppointmentWebhookPayload payload) {
        if (payload == null) {
            throw new PayloadValidationException("caller", "caller is required");
        }
        String phone = requirePhone("caller", payload.caller());
        OffsetDateTime scheduledAt = parseCallbackTime(payload.callbackTime());
        String email = optionalEmail(payload.email());

        return new AppointmentIntent(
                phone,
                TextNormalization.trimToNull(payload.customerName()),
                TextNormalization.trimToNull(payload.summary()),
                TextNormalization.trimToNull(payload.transcript()),
                TextNormalization.trimToNull(payload.intent()),
                scheduledAt,
                email,
                null,
                null
        );
    }

    public AppointmentIntent normalize(BookingRequest request) {
        if (request == null) {
            throw new PayloadValidationException("name", "name is required");
        }
        String name = requireText("name", request.name());
        String phone = requirePhone("phone", request.phone());
        String address = requireText("address", request.address());
        LocalDate date = parseBookingDate(request.preferredDate());
        LocalTime time = parseBookingTime(request.preferredTime());
        String email = optionalEmail(request.email());

        OffsetDateTime scheduledAt = LocalDateTime.of(date, time)
                .atZone(properties.defaultTimezone())
                .toOffsetDateTime();
        return new AppointmentIntent(
                phone,
                name,
                TextNormalization.trimToNull(request.notes()),
                null,
                BOOKING_INTENT_LABEL,
                scheduledAt,
                email,
                address,
                properties.bookingDuration()
        );
    }

    /**
     * Parses an ISO-8601 date-time. An explicit offset (or {@code Z}) is kept as is;
     * a value without one is placed in the configured default timezone. A bare date
     * means the start of that day in the default timezone.
     */
    OffsetDateTime parseCallbackTime(String raw) {
        String value = TextNormalization.trimToNull(raw);
        if (value == null) {
            throw new PayloadValidationException("callback_time", "callback_time is required");
        }
        if (value.indexOf('T') < 0) {
            return parseCallbackDate(value);
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parse(value);
            LocalDateTime local = LocalDateTime.from(parsed);
            if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
                return OffsetDateTime.from(parsed);
            }
            ZoneId zone = parsed.query(TemporalQueries.zone());
            return local.atZone(zone != null ? zone : properties.defaultTimezone()).toOffsetDateTime();
        } catch (DateTimeParseException e) {
            throw new PayloadValidationException("callback_time", "callback_time must be a valid ISO 8601 datetime");
        }
    }

    private OffsetDateTime parseCallbackDate(String value) {
        try {
            return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE)
                    .atStartOfDay(properties.defaultTimezone())
                    .toOffsetDateTime();
        } catch (DateTimeParseException e) {
            throw new PayloadValidationException("callback_time", "callback_time must be a valid ISO 8601 datetime");
        }
    }

    private String requirePhone(String field, String raw) {
        String phone = TextNormalization.trimToNull(raw);
        if (phone == null) {
            throw new PayloadValidationException(field, field + " is required");
        }
        if (TextNormalization.countDigits(phone) < MIN_PHONE_DIGITS) {
            throw new PayloadValidationException(field, "Phone number must contain at least " + MIN_PHONE_DIGITS + " digits");
        }
        return phone;
    }

    private String requireText(String field, String raw) {
        String value = TextNormalization.trimToNull(raw);
        if (value == null) {
            throw new PayloadValidationException(field, field + " is required");
        }
        return value;
    }

    private String optionalEmail(String raw) {
        String email = TextNormalization.trimToNull(raw);
        if (email == null) {
            return null;
        }
        if (!EMAIL_PATTERN.matcher(email).matches()) {
            throw new PayloadValidationException("email", "email must be a valid email address");
        }
        return email;
    }

    private LocalDate parseBookingDate(String raw) {
        String value = requireText("preferred_date", raw);
        try {
            return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            throw new PayloadValidationException("preferred_date", "preferred_date must use the YYYY-MM-DD format");
        }
    }

    private LocalTime parseBookingTime(String raw) {
        String value = requireText("preferred_time", raw);
        try {
            return LocalTime.parse(value, BOOKING_TIME_FMT);
        } catch (DateTimeParseException e) {
            throw new PayloadValidationException("preferred_time", "preferred_time must use the 24-hour HH:MM format");
        }
    }
}
