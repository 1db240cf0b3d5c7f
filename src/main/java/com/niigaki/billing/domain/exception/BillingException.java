package com.niigaki.billing.domain.exception;

import lombok.Getter;

@Getter
public class BillingException extends RuntimeException {

    private final BillingErrorCode code;

    public BillingException(BillingErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public BillingException(BillingErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }
}
