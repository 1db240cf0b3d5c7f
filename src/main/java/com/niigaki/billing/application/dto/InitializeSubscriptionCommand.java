package com.niigaki.billing.application.dto;

public record InitializeSubscriptionCommand(
        String tenantId,
        String planId,
        boolean startWithTrial,
        String billingType
) {
}
