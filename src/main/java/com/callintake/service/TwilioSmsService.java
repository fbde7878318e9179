package com.callintake.service;

import com.callintake.config.AppointmentProperties;
import com.callintake.config.TwilioProperties;
import com.callintake.domain.model.AppointmentIntent;
import com.callintake.domain.model.Channel;
import com.callintake.exception.ChannelDeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
public class TwilioSmsService implements SmsChannel {

    private static final DateTimeFormatter SMS_TIME_FMT =
            DateTimeFormatter.ofPattern("EEEE, MMMM dd 'at' hh:mm a", Locale.US);

    private final RestClient restClient;
    private final TwilioProperties properties;
    private final AppointmentProperties appointmentProperties;

    public TwilioSmsService(
            @Qualifier("twilioRestClient") RestClient restClient,
            TwilioProperties properties,
            AppointmentProperties appointmentProperties) {
        this.restClient = restClient;
        this.properties = properties;
        this.appointmentProperties = appointmentProperties;
    }

    @Override
    public boolean isConfigured() {
        return properties.isConfigured();
    }

    @Override
    public String sendConfirmation(AppointmentIntent intent) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("To", intent.callerPhone());
        form.add("From", properties.fromNumber());
        form.add("Body", formatMessage(intent));

        Map<?, ?> response;
        try {
            response = restClient.post()
                    .uri(properties.safeApiBase() + "/2010-04-01/Accounts/{accountSid}/Messages.json",
                            properties.accountSid())
                    .headers(headers -> headers.setBasicAuth(properties.accountSid(), properties.authToken()))
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(Map.class);
        } catch (RestClientResponseException e) {
            throw new ChannelDeliveryException(Channel.SMS,
                    "Twilio rejected the message: HTTP " + e.getStatusCode().value() + " " + e.getStatusText(), e);
        } catch (RestClientException e) {
            throw new ChannelDeliveryException(Channel.SMS, "Twilio request failed: " + e.getMessage(), e);
        }

        if (response == null || !(response.get("sid") instanceof String sid)) {
            throw new ChannelDeliveryException(Channel.SMS, "Twilio response did not contain a message sid");
        }
        log.info("SMS sent. to={}, sid={}", intent.callerPhone(), sid);
        return sid;
    }

    String formatMessage(AppointmentIntent intent) {
        String when = intent.scheduledAt()
                .atZoneSameInstant(appointmentProperties.safeDisplayTimezone())
                .format(SMS_TIME_FMT);

        StringBuilder sb = new StringBuilder();
        sb.append("Hi ").append(intent.customerName()).append("!\n\n");
        sb.append("Your appointment has been confirmed for ").append(when).append(".");
        if (intent.hasLocation()) {
            sb.append("\n\nLocation: ").append(intent.location());
        }
        sb.append("\n\nDetails: ").append(intent.summary());
        sb.append("\n\nReply CONFIRM to acknowledge or call us if you need to reschedule.");
        sb.append("\n\n- ").append(appointmentProperties.safeBusinessName()).append(" Team");
        return sb.toString();
    }
}
