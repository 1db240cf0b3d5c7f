package com.niigaki.billing.domain.model;

public enum WebhookEventStatus {
    PENDING,
    PROCESSING,
    PROCESSED,
    FAILED,
    IGNORED;

    public boolean isTerminalSuccess() {
        return this == PROCESSED || this == IGNORED;
    }
}
