package com.callintake.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.webhook")
public record WebhookProperties(
        String secret,
        String headerName,
        String queryParam,
        String path
) {
    public boolean isSecretConfigured() {
        return notBlank(secret);
    }

    public String safeHeaderName() {
        return notBlank(headerName) ? headerName : "X-Webhook-Secret";
    }

    public String safeQueryParam() {
        return notBlank(queryParam) ? queryParam : "secret";
    }

    public String safePath() {
        return notBlank(path) ? path : "/webhook";
    }

    private boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
