package com.niigaki.billing.application.webhook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AsaasPaymentPayload(
        String id,
        String customer,
        String subscription,
        BigDecimal value,
        BigDecimal netValue,
        String description,
        String billingType,
        String status,
        String dueDate,
        String originalDueDate,
        String paymentDate,
        String clientPaymentDate,
        String confirmedDate,
        String invoiceUrl,
        String externalReference,
        boolean deleted
) {
}
