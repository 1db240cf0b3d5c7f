package com.niigaki.billing.domain.repository;

import com.niigaki.billing.domain.model.WebhookEvent;
import com.niigaki.billing.domain.model.WebhookEventStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

public interface WebhookEventRepository extends MongoRepository<WebhookEvent, String> {

    Optional<WebhookEvent> findBySourceAndExternalEventId(String source, String externalEventId);

    List<WebhookEvent> findByStatusOrderByCreatedAtAsc(WebhookEventStatus status, Pageable pageable);

    List<WebhookEvent> findByStatusAndUpdatedAtBeforeOrderByUpdatedAtAsc(WebhookEventStatus status,
                                                                         OffsetDateTime cutoff,
                                                                         Pageable pageable);
}
