package com.callintake.domain.model;

public record CalendarBooking(String eventId, String eventLink) {
}
