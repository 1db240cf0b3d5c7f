package com.niigaki.billing.domain.service;

import com.niigaki.billing.domain.model.WebhookEvent;
import com.niigaki.billing.domain.model.WebhookEventStatus;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Durable webhook ledger.
 */
public interface WebhookEventStore {

    /**
     * Inserts a new entry.
     *
     * @throws org.springframework.dao.DuplicateKeyException when an entry with the same
     *                                                       {@code (source, externalEventId)} already exists
     */
    WebhookEvent insert(WebhookEvent event);

    Optional<WebhookEvent> findById(String id);

    Optional<WebhookEvent> findBySourceAndExternalEventId(String source, String externalEventId);

    /**
     * Atomically moves an entry from {@code expectedStatus} to {@code PROCESSING} and counts
     * the attempt, provided attempts are left and, when {@code lastUpdatedBefore} is given,
     * the entry has not been touched since then.
     *
     * @return the claimed entry, or empty if another worker got there first
     */
    Optional<WebhookEvent> claim(String id, WebhookEventStatus expectedStatus, OffsetDateTime lastUpdatedBefore);

    WebhookEvent save(WebhookEvent event);

    /**
     * Pending entries with attempts left, oldest first.
     */
    List<WebhookEvent> findRetryEligible(int limit);

    List<WebhookEvent> findProcessingNotUpdatedSince(OffsetDateTime cutoff, int limit);
}
