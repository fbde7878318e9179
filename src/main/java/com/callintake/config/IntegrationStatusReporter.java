package com.callintake.config;

import com.callintake.service.CalendarChannel;
import com.callintake.service.EmailChannel;
import com.callintake.service.SmsChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Logs collaborator configuration once at startup. Unconfigured channels are
 * reported here and nowhere else.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntegrationStatusReporter implements ApplicationRunner {

    private final WebhookProperties webhookProperties;
    private final AppointmentProperties appointmentProperties;
    private final CalendarChannel calendarChannel;
    private final SmsChannel smsChannel;
    private final EmailChannel emailChannel;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Call intake config: webhookPath={}, defaultTimezone={}, displayTimezone={}, channelTimeout={}",
                webhookProperties.safePath(),
                appointmentProperties.defaultTimezone(),
                appointmentProperties.safeDisplayTimezone(),
                appointmentProperties.channelTimeout());
        logChannel("Google Calendar", calendarChannel.isConfigured(), "calendar events will not be created");
        logChannel("Twilio SMS", smsChannel.isConfigured(), "SMS confirmations disabled");
        logChannel("Email", emailChannel.isConfigured(), "email confirmations disabled");

        if (!webhookProperties.isSecretConfigured()) {
            log.warn("No webhook secret configured. Every request to {} is accepted without authentication.",
                    webhookProperties.safePath());
        }
    }

    private void logChannel(String name, boolean configured, String consequence) {
        if (configured) {
            log.info("{}: configured", name);
        } else {
            log.warn("{}: not configured, {}", name, consequence);
        }
    }
}
