package com.niigaki.billing.domain.exception;

import lombok.Getter;

@Getter
public class WebhookInvalidException extends BillingException {

    private final String eventType;

    public WebhookInvalidException(String message) {
        this(message, null);
    }

    public WebhookInvalidException(String message, String eventType) {
        super(BillingErrorCode.WEBHOOK_INVALID_ERROR, message);
        this.eventType = eventType;
    }
}
