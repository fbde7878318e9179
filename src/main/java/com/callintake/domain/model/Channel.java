package com.callintake.domain.model;

public enum Channel {
    CALENDAR("calendar"),
    SMS("sms"),
    EMAIL("email");

    private final String key;

    Channel(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
