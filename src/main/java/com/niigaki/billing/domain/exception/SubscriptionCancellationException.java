package com.niigaki.billing.domain.exception;

import lombok.Getter;

@Getter
public class SubscriptionCancellationException extends BillingException {

    private final String subscriptionId;

    public SubscriptionCancellationException(String subscriptionId, String message) {
        this(subscriptionId, message, null);
    }

    public SubscriptionCancellationException(String subscriptionId, String message, Throwable cause) {
        super(BillingErrorCode.SUBSCRIPTION_CANCELLATION_ERROR, message, cause);
        this.subscriptionId = subscriptionId;
    }
}
