package com.niigaki.billing.domain.exception;

import com.niigaki.billing.domain.model.BillingStatus;
import lombok.Getter;

import java.util.List;

/**
 * The tenant's billing status does not allow what was asked for.
 */
@Getter
public class BillingStatusInvalidException extends BillingException {

    private final BillingStatus currentStatus;
    private final List<BillingStatus> requiredStatuses;

    public BillingStatusInvalidException(BillingStatus currentStatus, String message) {
        this(currentStatus, message, List.of());
    }

    public BillingStatusInvalidException(BillingStatus currentStatus, String message, List<BillingStatus> requiredStatuses) {
        super(BillingErrorCode.BILLING_STATUS_INVALID, message);
        this.currentStatus = currentStatus;
        this.requiredStatuses = requiredStatuses == null ? List.of() : List.copyOf(requiredStatuses);
    }
}
