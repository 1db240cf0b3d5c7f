package com.niigaki.billing.domain.exception;

import com.niigaki.billing.domain.model.BillingStatus;
import lombok.Getter;

@Getter
public class InvalidBillingTransitionException extends BillingException {

    private final BillingStatus from;
    private final BillingStatus to;

    public InvalidBillingTransitionException(BillingStatus from, BillingStatus to) {
        super(BillingErrorCode.INVALID_BILLING_TRANSITION,
                "Invalid billing status transition from '" + value(from) + "' to '" + value(to) + "'");
        this.from = from;
        this.to = to;
    }

    private static String value(BillingStatus status) {
        return status == null ? "null" : status.getValue();
    }
}
