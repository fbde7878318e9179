package com.callintake.service;

import com.callintake.config.WebhookProperties;
import com.callintake.exception.WebhookAuthenticationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Admits or denies a request by its shared secret. With no secret configured every
 * request is admitted; the startup report warns about it once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookSecretVerifier {

    private final WebhookProperties properties;

    /**
     * @param headerSecret secret from the request header, takes precedence when present
     * @param querySecret  secret from the query string
     * @throws WebhookAuthenticationException when a secret is configured and the candidate does not match
     */
    public void verify(String headerSecret, String querySecret) {
        if (!properties.isSecretConfigured()) {
            return;
        }
        String candidate = headerSecret != null ? headerSecret : querySecret;
        if (candidate == null || !constantTimeEquals(properties.secret(), candidate)) {
            log.warn("Rejected webhook request: invalid secret. provided={}, source={}",
                    candidate == null ? "null" : "***",
                    headerSecret != null ? "header" : querySecret != null ? "query" : "none");
            throw new WebhookAuthenticationException("Invalid or missing webhook secret");
        }
    }

    private boolean constantTimeEquals(String expected, String candidate) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                candidate.getBytes(StandardCharsets.UTF_8));
    }
}
