package com.callintake.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Result of one side-effect channel for one request.
 *
 * <p>A channel ends in exactly one of three states. {@link Status#SKIPPED} covers
 * both an unconfigured provider and missing optional input; it is not a failure.
 */
public record ChannelOutcome(Status status, String detail, String error) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    public ChannelOutcome {
        Objects.requireNonNull(status, "status");
    }

    public static ChannelOutcome succeeded(String detail) {
        return new ChannelOutcome(Status.SUCCEEDED, detail, null);
    }

    public static ChannelOutcome failed(String error) {
        return new ChannelOutcome(Status.FAILED, null, error == null || error.isBlank() ? "Unknown error" : error);
    }

    public static ChannelOutcome skipped(String reason) {
        return new ChannelOutcome(Status.SKIPPED, reason, null);
    }

    @JsonProperty("attempted")
    public boolean attempted() {
        return status != Status.SKIPPED;
    }

    @JsonProperty("succeeded")
    public boolean succeeded() {
        return status == Status.SUCCEEDED;
    }

    @JsonIgnore
    @Override
    public Status status() {
        return status;
    }
}
