package com.niigaki.billing.application.webhook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AsaasSubscriptionPayload(
        String id,
        String customer,
        BigDecimal value,
        String nextDueDate,
        String cycle,
        String description,
        String status,
        String billingType,
        String externalReference,
        boolean deleted
) {
}
