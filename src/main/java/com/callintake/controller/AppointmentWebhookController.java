package com.callintake.controller;

import com.callintake.domain.model.AppointmentIntent;
import com.callintake.domain.model.AppointmentResult;
import com.callintake.dto.AppointmentWebhookPayload;
import com.callintake.dto.AppointmentWebhookResponse;
import com.callintake.service.AppointmentOrchestrator;
import com.callintake.service.AppointmentPayloadNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Voice-agent webhook. The secret check runs in {@code WebhookSecretFilter}
 * before the request reaches the dispatcher.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class AppointmentWebhookController {

    private final AppointmentPayloadNormalizer normalizer;
    private final AppointmentOrchestrator orchestrator;

    @PostMapping(value = "${app.webhook.path:/webhook}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AppointmentWebhookResponse> webhook(@RequestBody AppointmentWebhookPayload payload) {
        log.info("Accepted appointment webhook. hasCaller={}, hasCallbackTime={}, hasEmail={}, intent={}",
                payload.caller() != null,
                payload.callbackTime() != null,
                payload.email() != null,
                payload.intent());

        AppointmentIntent intent = normalizer.normalize(payload);
        AppointmentResult result = orchestrator.process(intent);
        return ResponseEntity.ok(AppointmentWebhookResponse.from(result));
    }
}
