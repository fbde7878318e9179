package com.callintake.exception;

/**
 * Thrown when a request does not carry the configured shared secret.
 */
public class WebhookAuthenticationException extends RuntimeException {

    public WebhookAuthenticationException(String message) {
        super(message);
    }
}
