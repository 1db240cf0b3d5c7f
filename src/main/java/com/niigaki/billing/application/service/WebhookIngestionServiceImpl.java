package com.niigaki.billing.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.niigaki.billing.application.dto.RetrySummary;
import com.niigaki.billing.application.webhook.AsaasWebhookEvent;
import com.niigaki.billing.application.webhook.WebhookEventDispatcher;
import com.niigaki.billing.domain.exception.WebhookAuthenticationException;
import com.niigaki.billing.domain.exception.WebhookInvalidException;
import com.niigaki.billing.domain.model.ProcessingResult;
import com.niigaki.billing.domain.model.WebhookEvent;
import com.niigaki.billing.domain.model.WebhookEventStatus;
import com.niigaki.billing.domain.service.WebhookEventStore;
import com.niigaki.billing.domain.service.WebhookIngestionService;
import com.niigaki.billing.infrastructure.config.BillingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

@Service
@Slf4j
public class WebhookIngestionServiceImpl implements WebhookIngestionService {

    private final WebhookEventStore webhookEventStore;
    private final WebhookEventDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final BillingProperties billingProperties;

    public WebhookIngestionServiceImpl(WebhookEventStore webhookEventStore,
                                       WebhookEventDispatcher dispatcher,
                                       ObjectMapper objectMapper,
                                       BillingProperties billingProperties) {
        this.webhookEventStore = webhookEventStore;
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
        this.billingProperties = billingProperties;
    }

    @Override
    public ProcessingResult receive(String accessToken, String body) {
        if (!dispatcher.isAccessTokenValid(accessToken)) {
            throw new WebhookAuthenticationException("Invalid webhook access token");
        }
        if (body == null || body.isBlank()) {
            throw new WebhookInvalidException("Empty webhook body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new WebhookInvalidException("Unreadable webhook body: " + e.getOriginalMessage());
        }
        String eventType = trimToNull(root.path("event").asText(null));
        if (eventType == null) {
            throw new WebhookInvalidException("Webhook body has no event type");
        }
        String externalEventId = trimToNull(root.path("id").asText(null));

        WebhookEvent event = ingest(billingProperties.getWebhookSource(), externalEventId, eventType, body);
        return process(event);
    }

    @Override
    public WebhookEvent ingest(String source, String externalEventId, String eventType, String payload) {
        if (externalEventId != null) {
            Optional<WebhookEvent> existing = webhookEventStore.findBySourceAndExternalEventId(source, externalEventId);
            if (existing.isPresent()) {
                log.debug("Webhook already in ledger source={} externalEventId={} status={}",
                        source, externalEventId, existing.get().getStatus());
                return existing.get();
            }
        }

        WebhookEvent event = new WebhookEvent();
        event.setSource(source);
        event.setExternalEventId(externalEventId);
        event.setEventType(eventType);
        event.setPayload(payload);
        event.setStatus(WebhookEventStatus.PENDING);
        event.setMaxAttempts(Math.max(1, billingProperties.getWebhookMaxAttempts()));
        try {
            return webhookEventStore.insert(event);
        } catch (DuplicateKeyException e) {
            // a concurrent delivery of the same event won the insert
            return webhookEventStore.findBySourceAndExternalEventId(source, externalEventId)
                    .orElseThrow(() -> e);
        }
    }

    @Override
    public ProcessingResult process(WebhookEvent event) {
        WebhookEventStatus status = event.getStatus();
        if (status.isTerminalSuccess()) {
            log.debug("Skipping duplicate webhook id={} externalEventId={} status={}",
                    event.getId(), event.getExternalEventId(), status);
            return event.getResult() != null
                    ? event.getResult()
                    : ProcessingResult.success(event.getEventType(), event.getTenantId(), status.name().toLowerCase());
        }
        if (status == WebhookEventStatus.FAILED || !event.hasAttemptsLeft()) {
            log.debug("Webhook not eligible for processing id={} status={} attempts={}/{}",
                    event.getId(), status, event.getAttempts(), event.getMaxAttempts());
            return ProcessingResult.failure(event.getEventType(), event.getTenantId(),
                    firstNonBlank(event.getErrorMessage(), "Webhook event is not eligible for processing"), false);
        }
        if (status == WebhookEventStatus.PROCESSING) {
            return alreadyProcessing(event);
        }

        Optional<WebhookEvent> claimed = webhookEventStore.claim(event.getId(), WebhookEventStatus.PENDING, null);
        if (claimed.isEmpty()) {
            return alreadyProcessing(event);
        }
        return runClaimed(claimed.get());
    }

    @Override
    public RetrySummary retryPending() {
        int reclaimed = 0;
        int attempted = 0;
        int succeeded = 0;
        int batchSize = Math.max(1, billingProperties.getRetryBatchSize());

        OffsetDateTime cutoff = OffsetDateTime.now().minus(billingProperties.getProcessingStaleAfter());
        for (WebhookEvent stale : webhookEventStore.findProcessingNotUpdatedSince(cutoff, batchSize)) {
            if (!stale.hasAttemptsLeft()) {
                stale.setStatus(WebhookEventStatus.FAILED);
                stale.setErrorMessage(firstNonBlank(stale.getErrorMessage(), "Processing interrupted with no attempts left"));
                stale.setUpdatedAt(OffsetDateTime.now());
                webhookEventStore.save(stale);
                log.error("Stale webhook marked failed id={} eventType={} attempts={}",
                        stale.getId(), stale.getEventType(), stale.getAttempts());
                continue;
            }
            Optional<WebhookEvent> claimed = webhookEventStore.claim(stale.getId(), WebhookEventStatus.PROCESSING, cutoff);
            if (claimed.isPresent()) {
                reclaimed++;
                attempted++;
                log.warn("Reclaimed stale webhook id={} eventType={} attempts={}",
                        stale.getId(), stale.getEventType(), claimed.get().getAttempts());
                if (runClaimed(claimed.get()).success()) {
                    succeeded++;
                }
            }
        }

        List<WebhookEvent> eligible = webhookEventStore.findRetryEligible(batchSize);
        for (WebhookEvent event : eligible) {
            Optional<WebhookEvent> claimed = webhookEventStore.claim(event.getId(), WebhookEventStatus.PENDING, null);
            if (claimed.isEmpty()) {
                continue;
            }
            attempted++;
            if (runClaimed(claimed.get()).success()) {
                succeeded++;
            }
        }

        if (attempted > 0) {
            log.info("Webhook retry pass finished reclaimed={} attempted={} succeeded={}", reclaimed, attempted, succeeded);
        }
        return new RetrySummary(reclaimed, attempted, succeeded);
    }

    @Override
    public WebhookEvent resetFailed(String id) {
        WebhookEvent event = webhookEventStore.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Webhook event not found: " + id));
        if (event.getStatus() != WebhookEventStatus.FAILED) {
            throw new IllegalStateException("Only failed webhook events can be reset, id=" + id + " status=" + event.getStatus());
        }
        event.setStatus(WebhookEventStatus.PENDING);
        event.setAttempts(0);
        event.setErrorMessage(null);
        event.setUpdatedAt(OffsetDateTime.now());
        WebhookEvent saved = webhookEventStore.save(event);
        log.info("Failed webhook reset for reprocessing id={} eventType={}", id, event.getEventType());
        return saved;
    }

    private ProcessingResult runClaimed(WebhookEvent event) {
        ProcessingResult result;
        try {
            AsaasWebhookEvent parsed = objectMapper.readValue(event.getPayload(), AsaasWebhookEvent.class);
            result = dispatcher.dispatch(parsed);
        } catch (JsonProcessingException e) {
            result = ProcessingResult.failure(event.getEventType(), null,
                    "Unreadable webhook payload: " + e.getOriginalMessage(), false);
        }
        complete(event, result);
        return result;
    }

    private void complete(WebhookEvent event, ProcessingResult result) {
        OffsetDateTime now = OffsetDateTime.now();
        event.setResult(result);
        event.setUpdatedAt(now);
        if (result.tenantId() != null) {
            event.setTenantId(result.tenantId());
        }

        if (result.success()) {
            event.setStatus(result.isNoOp() ? WebhookEventStatus.IGNORED : WebhookEventStatus.PROCESSED);
            event.setProcessedAt(now);
            event.setErrorMessage(null);
        } else if (!result.retryable() || !event.hasAttemptsLeft()) {
            event.setStatus(WebhookEventStatus.FAILED);
            event.setErrorMessage(result.error());
            log.error("Webhook processing failed for good id={} eventType={} tenantId={} attempts={}/{} reason={}",
                    event.getId(), event.getEventType(), event.getTenantId(),
                    event.getAttempts(), event.getMaxAttempts(), result.error());
        } else {
            event.setStatus(WebhookEventStatus.PENDING);
            event.setErrorMessage(result.error());
            log.warn("Webhook processing failed, will retry id={} eventType={} tenantId={} attempts={}/{} reason={}",
                    event.getId(), event.getEventType(), event.getTenantId(),
                    event.getAttempts(), event.getMaxAttempts(), result.error());
        }
        webhookEventStore.save(event);
    }

    private ProcessingResult alreadyProcessing(WebhookEvent event) {
        log.debug("Webhook is being processed elsewhere id={} externalEventId={}", event.getId(), event.getExternalEventId());
        return ProcessingResult.success(event.getEventType(), event.getTenantId(), ProcessingResult.ACTION_ALREADY_PROCESSING);
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
