package com.callintake.service;

import com.callintake.domain.model.AppointmentIntent;

public interface EmailChannel {

    boolean isConfigured();

    /**
     * Sends the HTML and plain-text confirmation to the customer email of the intent.
     *
     * @param calendarLink link to the booked event, or {@code null} when none is available
     * @throws com.callintake.exception.ChannelDeliveryException if the transport fails
     */
    void sendConfirmation(AppointmentIntent intent, String calendarLink);
}
