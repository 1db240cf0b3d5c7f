package com.niigaki.billing.domain.exception;

import lombok.Getter;

@Getter
public class TenantBillingStoreException extends BillingException {

    private final String tenantId;

    public TenantBillingStoreException(String tenantId, String message) {
        this(tenantId, message, null);
    }

    public TenantBillingStoreException(String tenantId, String message, Throwable cause) {
        super(BillingErrorCode.TENANT_BILLING_STORE_ERROR, message, cause);
        this.tenantId = tenantId;
    }
}
