package com.niigaki.billing.domain.service;

import com.niigaki.billing.application.dto.RetrySummary;
import com.niigaki.billing.domain.model.ProcessingResult;
import com.niigaki.billing.domain.model.WebhookEvent;

/**
 * Records inbound webhooks in the ledger and drives their processing so that every delivery
 * is applied at most once and retried a bounded number of times.
 */
public interface WebhookIngestionService {

    /**
     * Entry point for an HTTP delivery: verifies the shared secret, records the delivery and
     * processes it.
     *
     * @throws com.niigaki.billing.domain.exception.WebhookAuthenticationException when the token
     *                                                                             does not match; nothing is recorded
     * @throws com.niigaki.billing.domain.exception.WebhookInvalidException        when the body cannot
     *                                                                             be read; nothing is recorded
     */
    ProcessingResult receive(String accessToken, String body);

    /**
     * Returns the ledger entry for the delivery, creating a pending one when it has not been
     * seen before. Deliveries without an external id are always recorded as new entries.
     */
    WebhookEvent ingest(String source, String externalEventId, String eventType, String payload);

    /**
     * Processes a ledger entry if it is eligible. Already processed or ignored entries return
     * their stored result untouched.
     */
    ProcessingResult process(WebhookEvent event);

    RetrySummary retryPending();

    /**
     * Puts a failed entry back in line with a fresh attempt budget.
     */
    WebhookEvent resetFailed(String id);
}
