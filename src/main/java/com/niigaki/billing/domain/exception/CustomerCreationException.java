package com.niigaki.billing.domain.exception;

import lombok.Getter;

@Getter
public class CustomerCreationException extends BillingException {

    private final String tenantId;

    public CustomerCreationException(String tenantId, String message, Throwable cause) {
        super(BillingErrorCode.CUSTOMER_CREATION_ERROR, message, cause);
        this.tenantId = tenantId;
    }
}
