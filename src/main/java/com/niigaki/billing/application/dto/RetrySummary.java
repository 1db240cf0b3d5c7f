package com.niigaki.billing.application.dto;

public record RetrySummary(
        int reclaimed,
        int attempted,
        int succeeded
) {
}
