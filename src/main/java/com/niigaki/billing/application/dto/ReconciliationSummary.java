package com.niigaki.billing.application.dto;

public record ReconciliationSummary(
        int synced,
        int failed
) {
}
