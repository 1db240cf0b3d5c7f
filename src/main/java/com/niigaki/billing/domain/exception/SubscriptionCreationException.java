package com.niigaki.billing.domain.exception;

import lombok.Getter;

@Getter
public class SubscriptionCreationException extends BillingException {

    private final String tenantId;
    private final String customerId;

    public SubscriptionCreationException(String tenantId, String customerId, String message, Throwable cause) {
        super(BillingErrorCode.SUBSCRIPTION_CREATION_ERROR, message, cause);
        this.tenantId = tenantId;
        this.customerId = customerId;
    }
}
