package com.callintake.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.twilio")
public record TwilioProperties(
        String accountSid,
        String authToken,
        String fromNumber,
        String apiBase
) {
    public boolean isConfigured() {
        return notBlank(accountSid)
                && notBlank(authToken)
                && notBlank(fromNumber);
    }

    public String safeApiBase() {
        return notBlank(apiBase) ? apiBase : "https://api.twilio.com";
    }

    private boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
