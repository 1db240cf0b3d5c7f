package com.niigaki.billing.application.dto;

import com.niigaki.billing.domain.model.BillingStatus;
import com.niigaki.billing.domain.model.SubscriptionMetadata;

public record InitializeSubscriptionResult(
        String subscriptionId,
        BillingStatus billingStatus,
        SubscriptionMetadata metadata
) {
}
