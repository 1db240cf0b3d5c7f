package com.niigaki.billing.infrastructure.persistence;

import com.niigaki.billing.domain.model.WebhookEvent;
import com.niigaki.billing.domain.model.WebhookEventStatus;
import com.niigaki.billing.domain.repository.WebhookEventRepository;
import com.niigaki.billing.domain.service.WebhookEventStore;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.MongoExpression;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MongoWebhookEventStore implements WebhookEventStore {

    private static final MongoExpression ATTEMPTS_LEFT =
            MongoExpression.create("{ $lt: ['$attempts', '$maxAttempts'] }");

    private final WebhookEventRepository webhookEventRepository;
    private final MongoTemplate mongoTemplate;

    @Override
    public WebhookEvent insert(WebhookEvent event) {
        OffsetDateTime now = OffsetDateTime.now();
        event.setCreatedAt(now);
        event.setUpdatedAt(now);
        return webhookEventRepository.insert(event);
    }

    @Override
    public Optional<WebhookEvent> findById(String id) {
        return webhookEventRepository.findById(id);
    }

    @Override
    public Optional<WebhookEvent> findBySourceAndExternalEventId(String source, String externalEventId) {
        if (externalEventId == null) {
            return Optional.empty();
        }
        return webhookEventRepository.findBySourceAndExternalEventId(source, externalEventId);
    }

    @Override
    public Optional<WebhookEvent> claim(String id, WebhookEventStatus expectedStatus, OffsetDateTime lastUpdatedBefore) {
        Criteria criteria = Criteria.where("id").is(id).and("status").is(expectedStatus);
        if (lastUpdatedBefore != null) {
            criteria = criteria.and("updatedAt").lt(lastUpdatedBefore);
        }
        Query query = Query.query(criteria).addCriteria(Criteria.expr(ATTEMPTS_LEFT));
        Update update = new Update()
                .set("status", WebhookEventStatus.PROCESSING)
                .inc("attempts", 1)
                .set("updatedAt", OffsetDateTime.now());

        WebhookEvent claimed = mongoTemplate.findAndModify(
                query,
                update,
                FindAndModifyOptions.options().returnNew(true),
                WebhookEvent.class
        );
        return Optional.ofNullable(claimed);
    }

    @Override
    public WebhookEvent save(WebhookEvent event) {
        return webhookEventRepository.save(event);
    }

    @Override
    public List<WebhookEvent> findRetryEligible(int limit) {
        return webhookEventRepository.findByStatusOrderByCreatedAtAsc(WebhookEventStatus.PENDING, PageRequest.of(0, limit))
                .stream()
                .filter(WebhookEvent::isRetryEligible)
                .toList();
    }

    @Override
    public List<WebhookEvent> findProcessingNotUpdatedSince(OffsetDateTime cutoff, int limit) {
        return webhookEventRepository.findByStatusAndUpdatedAtBeforeOrderByUpdatedAtAsc(
                WebhookEventStatus.PROCESSING, cutoff, PageRequest.of(0, limit));
    }
}
