package com.niigaki.billing.domain.exception;

public class TenantBillingNotFoundException extends TenantBillingStoreException {

    public TenantBillingNotFoundException(String tenantId) {
        super(tenantId, "Tenant billing record not found: " + tenantId);
    }
}
