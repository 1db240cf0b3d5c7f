package com.niigaki.billing.application.dto;

import com.niigaki.billing.domain.model.BillingStatus;

/**
 * Coarse authorization signals derived from a tenant's billing status.
 */
public record AccessContext(
        String tenantId,
        BillingStatus billingStatus,
        boolean subscriptionActive,
        boolean inTrial,
        boolean isOverdue,
        boolean isSuspended,
        Integer daysOverdue
) {
}
