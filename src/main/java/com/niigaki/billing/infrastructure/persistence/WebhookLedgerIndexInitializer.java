package com.niigaki.billing.infrastructure.persistence;

import com.niigaki.billing.domain.model.WebhookEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.stereotype.Component;

/**
 * Ensures the ledger's dedup key. Entries without an external id stay outside the index, so
 * any number of them may share a source.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookLedgerIndexInitializer {

    static final String DEDUP_INDEX = "source_external_event_id_uq";

    private final MongoTemplate mongoTemplate;

    @EventListener(ApplicationReadyEvent.class)
    public void ensureIndexes() {
        Index dedup = new Index()
                .on("source", Sort.Direction.ASC)
                .on("externalEventId", Sort.Direction.ASC)
                .unique()
                .named(DEDUP_INDEX)
                .partial(PartialIndexFilter.of(Criteria.where("externalEventId").exists(true)));
        String name = mongoTemplate.indexOps(WebhookEvent.class).ensureIndex(dedup);
        log.info("Webhook ledger index ready name={}", name);
    }
}
