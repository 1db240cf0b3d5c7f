package com.niigaki.billing.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionMetadata {

    private String planId;
    private String planName;
    private Long priceInCents;
    private String currency;
    private BillingCycle cycle;
    private LocalDate trialEndDate;
    private LocalDate nextBillingDate;
    private OffsetDateTime lastPaymentDate;
    private Integer daysOverdue;

    public static SubscriptionMetadata fromPlan(BillingPlan plan) {
        return SubscriptionMetadata.builder()
                .planId(plan.id())
                .planName(plan.name())
                .priceInCents(plan.priceInCents())
                .currency(plan.currency())
                .cycle(plan.cycle())
                .build();
    }

    public SubscriptionMetadata copy() {
        return toBuilder().build();
    }
}
