package com.niigaki.billing.domain.model;

import java.util.List;

/**
 * Catalog entry. Read by the subscription lifecycle, never written by it.
 */
public record BillingPlan(
        String id,
        String name,
        String description,
        long priceInCents,
        String currency,
        BillingCycle cycle,
        int trialDays,
        List<String> features,
        boolean active
) {

    public BillingPlan {
        features = features == null ? List.of() : List.copyOf(features);
    }

    public boolean offersTrial() {
        return trialDays > 0;
    }
}
