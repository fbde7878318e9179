package com.callintake.controller;

import com.callintake.domain.model.CalendarBooking;
import com.callintake.domain.model.Channel;
import com.callintake.exception.ChannelDeliveryException;
import com.callintake.service.AppointmentOrchestrator;
import com.callintake.service.AppointmentPayloadNormalizer;
import com.callintake.service.CalendarChannel;
import com.callintake.service.EmailChannel;
import com.callintake.service.SmsChannel;
import com.callintake.service.WebhookSecretVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.concurrent.Executor;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(
        controllers = {AppointmentWebhookController.class, BookingController.class, HealthController.class},
        properties = {
                "app.webhook.secret=s3cret",
                "app.appointment.default-timezone=America/New_York",
                "app.appointment.display-timezone=America/Los_Angeles"
        })
@Import({
        AppointmentPayloadNormalizer.class,
        AppointmentOrchestrator.class,
        WebhookSecretVerifier.class,
        AppointmentWebhookControllerTest.DirectExecutorConfig.class
})
class AppointmentWebhookControllerTest {

    private static final String BODY = """
            {"caller":"+14155550123","callback_time":"2025-12-08T15:00:00-08:00","email":"a@b.com"}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CalendarChannel calendarChannel;

    @MockBean
    private SmsChannel smsChannel;

    @MockBean
    private EmailChannel emailChannel;

    @BeforeEach
    void setUp() {
        when(calendarChannel.isConfigured()).thenReturn(true);
        when(smsChannel.isConfigured()).thenReturn(true);
        when(emailChannel.isConfigured()).thenReturn(true);
        when(calendarChannel.createEvent(any()))
                .thenReturn(new CalendarBooking("evt-1", "https://calendar.google.com/event?eid=1"));
        when(smsChannel.sendConfirmation(any())).thenReturn("SM1");
    }

    @Test
    void allChannelsHealthy() throws Exception {
        mockMvc.perform(post("/webhook")
                        .header("X-Webhook-Secret", "s3cret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.data.calendar_created").value(true))
                .andExpect(jsonPath("$.data.sms_sent").value(true))
                .andExpect(jsonPath("$.data.email_sent").value(true))
                .andExpect(jsonPath("$.data.calendar_event_id").value("evt-1"))
                .andExpect(jsonPath("$.data.calendar_link").value("https://calendar.google.com/event?eid=1"))
                .andExpect(jsonPath("$.channels.calendar.attempted").value(true))
                .andExpect(jsonPath("$.channels.sms.succeeded").value(true))
                .andExpect(jsonPath("$.channels.email.attempted").value(true))
                .andExpect(jsonPath("$.customer.name").value("Customer"))
                .andExpect(jsonPath("$.customer.phone").value("+14155550123"))
                .andExpect(jsonPath("$.customer.email").value("a@b.com"))
                .andExpect(jsonPath("$.appointment_time").value("2025-12-08T15:00:00-08:00"));
    }

    @Test
    void unconfiguredSmsIsReportedAsNotAttempted() throws Exception {
        when(smsChannel.isConfigured()).thenReturn(false);

        mockMvc.perform(post("/webhook?secret=s3cret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sms_sent").value(false))
                .andExpect(jsonPath("$.channels.sms.attempted").value(false))
                .andExpect(jsonPath("$.channels.sms.error").doesNotExist())
                .andExpect(jsonPath("$.data.calendar_created").value(true))
                .andExpect(jsonPath("$.data.email_sent").value(true));
        verify(smsChannel, never()).sendConfirmation(any());
    }

    @Test
    void calendarFailureStillReturnsOk() throws Exception {
        when(calendarChannel.createEvent(any()))
                .thenThrow(new ChannelDeliveryException(Channel.CALENDAR, "Google Calendar request failed: timeout"));

        mockMvc.perform(post("/webhook")
                        .header("X-Webhook-Secret", "s3cret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.calendar_created").value(false))
                .andExpect(jsonPath("$.data.calendar_link").doesNotExist())
                .andExpect(jsonPath("$.channels.calendar.attempted").value(true))
                .andExpect(jsonPath("$.channels.calendar.error").value("Google Calendar request failed: timeout"))
                .andExpect(jsonPath("$.data.sms_sent").value(true))
                .andExpect(jsonPath("$.data.email_sent").value(true));
    }

    @Test
    void missingEmailSkipsEmailChannel() throws Exception {
        mockMvc.perform(post("/webhook")
                        .header("X-Webhook-Secret", "s3cret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"caller\":\"+14155550123\",\"callback_time\":\"2025-12-08T15:00:00\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.channels.email.attempted").value(false))
                .andExpect(jsonPath("$.data.email_sent").value(false))
                .andExpect(jsonPath("$.data.calendar_created").value(true))
                .andExpect(jsonPath("$.data.sms_sent").value(true))
                .andExpect(jsonPath("$.appointment_time").value("2025-12-08T15:00:00-05:00"));
        verifyNoInteractions(emailChannel);
    }

    @Test
    void wrongSecretIsForbiddenAndNothingIsAttempted() throws Exception {
        mockMvc.perform(post("/webhook")
                        .header("X-Webhook-Secret", "nope")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").isNotEmpty());
        verifyNoInteractions(calendarChannel, smsChannel, emailChannel);
    }

    @Test
    void missingSecretIsForbiddenEvenForMalformedBody() throws Exception {
        mockMvc.perform(post("/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isForbidden());
    }

    @Test
    void unauthenticatedRequestIsForbiddenBeforeContentTypeCheck() throws Exception {
        mockMvc.perform(post("/webhook")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("hello"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.status").value("error"));
        verifyNoInteractions(calendarChannel, smsChannel, emailChannel);
    }

    @Test
    void authenticatedRequestWithWrongContentTypeIsUnsupported() throws Exception {
        mockMvc.perform(post("/webhook")
                        .header("X-Webhook-Secret", "s3cret")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("hello"))
                .andExpect(status().isUnsupportedMediaType());
    }

    @Test
    void bareDateCallbackTimeBooksMidnightInDefaultTimezone() throws Exception {
        mockMvc.perform(post("/webhook")
                        .header("X-Webhook-Secret", "s3cret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"caller\":\"+14155550123\",\"callback_time\":\"2025-12-08\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.appointment_time").value("2025-12-08T00:00:00-05:00"))
                .andExpect(jsonPath("$.data.calendar_created").value(true));
    }

    @ParameterizedTest
    @ValueSource(strings = {"2025-12-08T15:00:00.75-08:00", "2025-12-08T15:00:00+00:00", "2025-12-08T15:00:00.123456+05:30"})
    void appointmentTimeKeepsFractionAndNumericOffset(String callbackTime) throws Exception {
        mockMvc.perform(post("/webhook")
                        .header("X-Webhook-Secret", "s3cret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"caller\":\"+14155550123\",\"callback_time\":\"" + callbackTime + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.appointment_time").value(callbackTime));
    }

    @Test
    void shortPhoneIsRejectedWithFieldName() throws Exception {
        mockMvc.perform(post("/webhook")
                        .header("X-Webhook-Secret", "s3cret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"caller\":\"555-0123\",\"callback_time\":\"2025-12-08T15:00:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.field").value("caller"));
        verifyNoInteractions(calendarChannel, smsChannel, emailChannel);
    }

    @Test
    void unparsableCallbackTimeIsRejectedWithFieldName() throws Exception {
        mockMvc.perform(post("/webhook")
                        .header("X-Webhook-Secret", "s3cret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"caller\":\"+14155550123\",\"callback_time\":\"next tuesday\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("callback_time"));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/webhook")
                        .header("X-Webhook-Secret", "s3cret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("body"));
    }

    @Test
    void bookingRunsThroughSameChannels() throws Exception {
        mockMvc.perform(post("/booking")
                        .header("X-Webhook-Secret", "s3cret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"Sam Rivers","phone":"(503) 555-0199","address":"12 Elm St",
                                 "preferred_date":"2025-12-09","preferred_time":"14:30"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.event_id").value("evt-1"))
                .andExpect(jsonPath("$.scheduled_start").value("2025-12-09T14:30:00-05:00"))
                .andExpect(jsonPath("$.channels.email.attempted").value(false));
    }

    @Test
    void bookingRequiresSecret() throws Exception {
        mockMvc.perform(post("/booking")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isForbidden());
    }

    @Test
    void healthReportsDegradedWhenAChannelIsUnconfigured() throws Exception {
        when(emailChannel.isConfigured()).thenReturn(false);

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("degraded"))
                .andExpect(jsonPath("$.services.google_calendar").value(true))
                .andExpect(jsonPath("$.services.twilio_sms").value(true))
                .andExpect(jsonPath("$.services.email").value(false));
    }

    @Test
    void rootDescribesEndpoints() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("operational"))
                .andExpect(jsonPath("$.endpoints.webhook").value("/webhook"));
    }

    @TestConfiguration
    static class DirectExecutorConfig {

        @Bean(name = "channelExecutor")
        Executor channelExecutor() {
            return Runnable::run;
        }
    }
}
