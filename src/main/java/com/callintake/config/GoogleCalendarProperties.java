package com.callintake.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.google.calendar")
public record GoogleCalendarProperties(
        boolean enabled,
        String calendarId,
        String clientId,
        String clientSecret,
        String refreshToken,
        String tokenUri,
        String apiBase,
        String sendUpdates
) {
    public boolean isConfigured() {
        return enabled
                && notBlank(clientId)
                && notBlank(clientSecret)
                && notBlank(refreshToken);
    }

    public String safeCalendarId() {
        return notBlank(calendarId) ? calendarId : "primary";
    }

    public String safeTokenUri() {
        return notBlank(tokenUri) ? tokenUri : "https://oauth2.googleapis.com/token";
    }

    public String safeApiBase() {
        return notBlank(apiBase) ? apiBase : "https://www.googleapis.com/calendar/v3";
    }

    public String safeSendUpdates() {
        return notBlank(sendUpdates) ? sendUpdates : "all";
    }

    private boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
