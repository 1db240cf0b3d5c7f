package com.niigaki.billing.domain.exception;

/**
 * The delivery did not carry the configured shared secret.
 */
public class WebhookAuthenticationException extends WebhookInvalidException {

    public WebhookAuthenticationException(String message) {
        super(message);
    }
}
