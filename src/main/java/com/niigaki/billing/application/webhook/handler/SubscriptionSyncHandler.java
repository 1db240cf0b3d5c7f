package com.niigaki.billing.application.webhook.handler;

import com.niigaki.billing.application.webhook.AsaasEventType;
import com.niigaki.billing.application.webhook.AsaasWebhookEvent;
import com.niigaki.billing.domain.model.ProcessingResult;
import com.niigaki.billing.domain.model.TenantBillingRecord;
import com.niigaki.billing.domain.service.SubscriptionService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * The processor owns subscription state, so these events trigger a full sync instead of a
 * direct transition.
 */
@Component
@Order(200)
@RequiredArgsConstructor
public class SubscriptionSyncHandler implements WebhookEventHandler {

    private final SubscriptionService subscriptionService;

    @Override
    public boolean supports(AsaasEventType eventType) {
        return eventType == AsaasEventType.SUBSCRIPTION_ACTIVATED
                || eventType == AsaasEventType.SUBSCRIPTION_UPDATED
                || eventType == AsaasEventType.SUBSCRIPTION_RENEWED;
    }

    @Override
    public ProcessingResult handle(AsaasEventType eventType, TenantBillingRecord tenant, AsaasWebhookEvent event) {
        subscriptionService.sync(tenant.getTenantId());
        String action = eventType == AsaasEventType.SUBSCRIPTION_ACTIVATED ? "subscription_synced" : "subscription_updated";
        return ProcessingResult.success(eventType.name(), tenant.getTenantId(), action);
    }
}
