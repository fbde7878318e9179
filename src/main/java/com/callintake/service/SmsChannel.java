package com.callintake.service;

import com.callintake.domain.model.AppointmentIntent;

public interface SmsChannel {

    boolean isConfigured();

    /**
     * Sends the confirmation text to the caller.
     *
     * @return provider message id
     * @throws com.callintake.exception.ChannelDeliveryException if the provider call fails
     */
    String sendConfirmation(AppointmentIntent intent);
}
