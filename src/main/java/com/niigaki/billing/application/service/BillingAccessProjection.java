package com.niigaki.billing.application.service;

import com.niigaki.billing.application.dto.AccessContext;
import com.niigaki.billing.domain.model.BillingStateMachine;
import com.niigaki.billing.domain.model.BillingStatus;
import com.niigaki.billing.domain.model.SubscriptionMetadata;
import com.niigaki.billing.domain.model.TenantBillingRecord;

/**
 * Read-only view of a billing record for authorization decisions. Computed on every read.
 */
public final class BillingAccessProjection {

    private BillingAccessProjection() {
    }

    public static AccessContext project(TenantBillingRecord record) {
        BillingStatus status = record.getBillingStatus();
        SubscriptionMetadata metadata = record.getSubscriptionMetadata();
        return new AccessContext(
                record.getTenantId(),
                status,
                BillingStateMachine.hasFullAccess(status),
                status == BillingStatus.TRIAL,
                status == BillingStatus.OVERDUE,
                // canceled tenants are denied exactly like suspended ones
                status == BillingStatus.SUSPENDED || status == BillingStatus.CANCELED,
                metadata == null ? null : metadata.getDaysOverdue()
        );
    }
}
