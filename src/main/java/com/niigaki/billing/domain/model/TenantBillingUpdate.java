package com.niigaki.billing.domain.model;

import lombok.Builder;

/**
 * Partial update of a {@link TenantBillingRecord}. Null fields are left untouched.
 * <p>
 * When {@code billingStatus} is set, {@code expectedStatus} names the status the change was
 * validated against; the store refuses the write if the record moved in the meantime.
 */
@Builder
public record TenantBillingUpdate(
        BillingStatus expectedStatus,
        BillingStatus billingStatus,
        SubscriptionMetadata subscriptionMetadata,
        String externalCustomerId,
        String externalSubscriptionId
) {

    public boolean isEmpty() {
        return billingStatus == null
                && subscriptionMetadata == null
                && externalCustomerId == null
                && externalSubscriptionId == null;
    }
}
