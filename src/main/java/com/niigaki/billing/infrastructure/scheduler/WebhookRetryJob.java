package com.niigaki.billing.infrastructure.scheduler;

import com.niigaki.billing.domain.service.WebhookIngestionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@ConditionalOnProperty(prefix = "niigaki.billing", name = "scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class WebhookRetryJob {

    private final WebhookIngestionService webhookIngestionService;

    public WebhookRetryJob(WebhookIngestionService webhookIngestionService) {
        this.webhookIngestionService = webhookIngestionService;
    }

    @Scheduled(cron = "${niigaki.billing.retry-cron:0 */5 * * * *}")
    public void retryPendingWebhooks() {
        try {
            webhookIngestionService.retryPending();
        } catch (RuntimeException e) {
            log.error("Webhook retry pass aborted reason={}", e.getMessage(), e);
        }
    }
}
