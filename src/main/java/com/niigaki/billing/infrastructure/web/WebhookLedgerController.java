package com.niigaki.billing.infrastructure.web;

import com.niigaki.billing.domain.model.WebhookEvent;
import com.niigaki.billing.domain.model.WebhookEventStatus;
import com.niigaki.billing.domain.service.WebhookIngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator actions on the webhook ledger.
 */
@RestController
@RequestMapping("/api/webhook-events")
@RequiredArgsConstructor
public class WebhookLedgerController {

    private final WebhookIngestionService webhookIngestionService;

    @PostMapping("/{id}/reset")
    public LedgerEntryView reset(@PathVariable String id) {
        return LedgerEntryView.of(webhookIngestionService.resetFailed(id));
    }

    public record LedgerEntryView(String id, String eventType, WebhookEventStatus status, int attempts, int maxAttempts) {

        static LedgerEntryView of(WebhookEvent event) {
            return new LedgerEntryView(event.getId(), event.getEventType(), event.getStatus(),
                    event.getAttempts(), event.getMaxAttempts());
        }
    }
}
