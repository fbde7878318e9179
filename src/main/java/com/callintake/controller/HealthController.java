package com.callintake.controller;

import com.callintake.config.WebhookProperties;
import com.callintake.service.CalendarChannel;
import com.callintake.service.EmailChannel;
import com.callintake.service.SmsChannel;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    static final String SERVICE_NAME = "Call Intake Webhook Handler";
    static final String VERSION = "1.0.0";

    private final WebhookProperties webhookProperties;
    private final CalendarChannel calendarChannel;
    private final SmsChannel smsChannel;
    private final EmailChannel emailChannel;

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", SERVICE_NAME);
        body.put("version", VERSION);
        body.put("status", "operational");
        body.put("endpoints", Map.of(
                "health", "/health",
                "webhook", webhookProperties.safePath(),
                "booking", "/booking"
        ));
        return body;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Boolean> services = new LinkedHashMap<>();
        services.put("google_calendar", calendarChannel.isConfigured());
        services.put("twilio_sms", smsChannel.isConfigured());
        services.put("email", emailChannel.isConfigured());
        boolean allHealthy = services.values().stream().allMatch(Boolean::booleanValue);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", allHealthy ? "healthy" : "degraded");
        body.put("timestamp", Instant.now().toString());
        body.put("services", services);
        return body;
    }
}
