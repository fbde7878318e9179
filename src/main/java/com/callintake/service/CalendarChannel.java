package com.callintake.service;

import com.callintake.domain.model.AppointmentIntent;
import com.callintake.domain.model.CalendarBooking;

public interface CalendarChannel {

    boolean isConfigured();

    /**
     * Creates one calendar event for the intent. Single attempt, no retry.
     *
     * @throws com.callintake.exception.ChannelDeliveryException if the provider call fails
     */
    CalendarBooking createEvent(AppointmentIntent intent);
}
