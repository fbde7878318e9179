package com.callintake.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.email")
public record EmailProperties(
        String from,
        String username,
        String password,
        String host,
        Integer port,
        Boolean starttls
) {
    public boolean isConfigured() {
        return notBlank(from) && notBlank(password);
    }

    public String safeUsername() {
        return notBlank(username) ? username : from;
    }

    public String safeHost() {
        return notBlank(host) ? host : "smtp.gmail.com";
    }

    public int safePort() {
        return port != null && port > 0 ? port : 587;
    }

    public boolean safeStarttls() {
        return starttls == null || starttls;
    }

    private boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
