package com.niigaki.billing.domain.exception;

public enum BillingErrorCode {
    BILLING_ERROR(true),
    SUBSCRIPTION_CREATION_ERROR(true),
    SUBSCRIPTION_CANCELLATION_ERROR(true),
    CUSTOMER_CREATION_ERROR(true),
    WEBHOOK_INVALID_ERROR(false),
    BILLING_STATUS_INVALID(true),
    ASAAS_API_ERROR(true),
    TENANT_BILLING_STORE_ERROR(true),
    INVALID_BILLING_TRANSITION(true);

    private final boolean retryable;

    BillingErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether a webhook that failed with this code may be attempted again by the ledger.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
