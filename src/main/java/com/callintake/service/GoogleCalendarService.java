package com.callintake.service;

import com.callintake.config.AppointmentProperties;
import com.callintake.config.GoogleCalendarProperties;
import com.callintake.domain.model.AppointmentIntent;
import com.callintake.domain.model.CalendarBooking;
import com.callintake.domain.model.Channel;
import com.callintake.exception.ChannelDeliveryException;
import com.callintake.util.TextNormalization;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Books appointments in Google Calendar through the REST API.
 *
 * <p>An access token is exchanged from the configured refresh token on every call,
 * so nothing is cached between requests.
 */
@Slf4j
@Service
public class GoogleCalendarService implements CalendarChannel {

    static final int EMAIL_REMINDER_MINUTES = 24 * 60;
    static final int POPUP_REMINDER_MINUTES = 30;

    private final RestClient restClient;
    private final GoogleCalendarProperties properties;
    private final AppointmentProperties appointmentProperties;

    public GoogleCalendarService(
            @Qualifier("googleRestClient") RestClient restClient,
            GoogleCalendarProperties properties,
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
    public CalendarBooking createEvent(AppointmentIntent intent) {
        String accessToken = fetchAccessToken();
        Map<String, Object> payload = buildEvent(intent);
        String calendarId = properties.safeCalendarId();

        Map<?, ?> response;
        try {
            response = restClient.post()
                    .uri(properties.safeApiBase() + "/calendars/{calendarId}/events?sendUpdates={sendUpdates}",
                            calendarId, properties.safeSendUpdates())
                    .header("Authorization", "Bearer " + accessToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(Map.class);
        } catch (RestClientResponseException e) {
            throw new ChannelDeliveryException(Channel.CALENDAR,
                    "Google Calendar rejected the event: HTTP " + e.getStatusCode().value() + " " + e.getStatusText(), e);
        } catch (RestClientException e) {
            throw new ChannelDeliveryException(Channel.CALENDAR, "Google Calendar request failed: " + e.getMessage(), e);
        }

        if (response == null || !(response.get("id") instanceof String eventId)) {
            throw new ChannelDeliveryException(Channel.CALENDAR, "Google Calendar response did not contain an event id");
        }
        String link = response.get("htmlLink") instanceof String s ? s : null;
        log.info("Google Calendar event created. calendarId={}, eventId={}", calendarId, eventId);
        return new CalendarBooking(eventId, link);
    }

    Map<String, Object> buildEvent(AppointmentIntent intent) {
        ZoneId zoneId = appointmentProperties.safeDisplayTimezone();
        Duration duration = intent.duration() != null ? intent.duration() : appointmentProperties.duration();
        OffsetDateTime startsAt = intent.scheduledAt();
        OffsetDateTime endsAt = startsAt.plus(duration);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("summary", "Appointment: " + intent.customerName());
        payload.put("description", buildDescription(intent));
        if (intent.hasLocation()) {
            payload.put("location", intent.location());
        }
        payload.put("start", Map.of(
                "dateTime", startsAt.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                "timeZone", zoneId.getId()
        ));
        payload.put("end", Map.of(
                "dateTime", endsAt.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                "timeZone", zoneId.getId()
        ));

        List<Map<String, Object>> attendees = new ArrayList<>();
        if (intent.hasEmail()) {
            attendees.add(Map.of("email", intent.customerEmail()));
        }
        payload.put("attendees", attendees);
        payload.put("reminders", Map.of(
                "useDefault", false,
                "overrides", List.of(
                        Map.of("method", "email", "minutes", EMAIL_REMINDER_MINUTES),
                        Map.of("method", "popup", "minutes", POPUP_REMINDER_MINUTES)
                )
        ));
        return payload;
    }

    String buildDescription(AppointmentIntent intent) {
        StringBuilder sb = new StringBuilder();
        sb.append("Customer: ").append(intent.customerName()).append("\n");
        sb.append("Phone: ").append(intent.callerPhone()).append("\n");
        if (intent.hasEmail()) {
            sb.append("Email: ").append(intent.customerEmail()).append("\n");
        }
        if (intent.intentLabel() != null) {
            sb.append("Intent: ").append(intent.intentLabel()).append("\n");
        }
        if (intent.hasLocation()) {
            sb.append("Location: ").append(intent.location()).append("\n");
        }
        sb.append("\nSummary:\n").append(intent.summary());
        if (intent.transcript() != null) {
            sb.append("\n\nTranscript:\n")
                    .append(TextNormalization.truncate(intent.transcript(), appointmentProperties.transcriptMaxChars()));
        }
        return sb.toString();
    }

    private String fetchAccessToken() {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", properties.clientId());
        body.add("client_secret", properties.clientSecret());
        body.add("refresh_token", properties.refreshToken());
        body.add("grant_type", "refresh_token");

        Map<?, ?> tokenResp;
        try {
            tokenResp = restClient.post()
                    .uri(properties.safeTokenUri())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(body)
                    .retrieve()
                    .body(Map.class);
        } catch (RestClientResponseException e) {
            throw new ChannelDeliveryException(Channel.CALENDAR,
                    "Google OAuth token refresh rejected: HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new ChannelDeliveryException(Channel.CALENDAR, "Google OAuth token refresh failed: " + e.getMessage(), e);
        }
        if (tokenResp == null || !(tokenResp.get("access_token") instanceof String token) || token.isBlank()) {
            throw new ChannelDeliveryException(Channel.CALENDAR, "Google token response did not contain an access token");
        }
        return token;
    }
}
