package com.niigaki.billing.domain.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.OffsetDateTime;

/**
 * Ledger entry for one inbound webhook delivery.
 * <p>
 * {@code (source, externalEventId)} is unique whenever an external id is present; that index is
 * partial and is created by {@code WebhookLedgerIndexInitializer}.
 */
@Document(collection = "webhook_events")
@CompoundIndex(name = "status_attempts_created_idx", def = "{'status': 1, 'attempts': 1, 'createdAt': 1}")
@Data
public class WebhookEvent {

    @Id
    private String id;

    private String source;
    private String externalEventId;

    @Indexed
    private String eventType;
    private String payload;

    private WebhookEventStatus status = WebhookEventStatus.PENDING;
    private int attempts;
    private int maxAttempts = 3;

    private OffsetDateTime processedAt;
    private String errorMessage;
    private ProcessingResult result;

    @Indexed(sparse = true)
    private String tenantId;

    private OffsetDateTime createdAt = OffsetDateTime.now();
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public boolean hasAttemptsLeft() {
        return attempts < maxAttempts;
    }

    public boolean isRetryEligible() {
        return status == WebhookEventStatus.PENDING && hasAttemptsLeft();
    }
}
