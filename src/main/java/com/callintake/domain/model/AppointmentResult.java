package com.callintake.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate of one request: the intent plus one outcome per channel.
 * {@code booking} is present only when the calendar channel succeeded.
 */
public record AppointmentResult(
        AppointmentIntent intent,
        ChannelOutcome calendar,
        ChannelOutcome sms,
        ChannelOutcome email,
        CalendarBooking booking
) {
    public AppointmentResult {
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(calendar, "calendar");
        Objects.requireNonNull(sms, "sms");
        Objects.requireNonNull(email, "email");
    }

    public String calendarEventId() {
        return booking == null ? null : booking.eventId();
    }

    public String calendarLink() {
        return booking == null ? null : booking.eventLink();
    }

    public Map<String, ChannelOutcome> outcomes() {
        Map<String, ChannelOutcome> outcomes = new LinkedHashMap<>();
        outcomes.put(Channel.CALENDAR.key(), calendar);
        outcomes.put(Channel.SMS.key(), sms);
        outcomes.put(Channel.EMAIL.key(), email);
        return outcomes;
    }
}
