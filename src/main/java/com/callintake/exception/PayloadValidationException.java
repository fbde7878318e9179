package com.callintake.exception;

/**
 * Thrown when a required field is missing or malformed. Carries the name of the
 * first offending field as it appears in the request body.
 */
public class PayloadValidationException extends RuntimeException {

    private final String field;

    public PayloadValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
