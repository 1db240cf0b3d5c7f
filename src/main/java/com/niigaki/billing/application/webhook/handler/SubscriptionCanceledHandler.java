package com.niigaki.billing.application.webhook.handler;

import com.niigaki.billing.application.webhook.AsaasEventType;
import com.niigaki.billing.application.webhook.AsaasWebhookEvent;
import com.niigaki.billing.domain.exception.BillingException;
import com.niigaki.billing.domain.exception.InvalidBillingTransitionException;
import com.niigaki.billing.domain.model.BillingStatus;
import com.niigaki.billing.domain.model.ProcessingResult;
import com.niigaki.billing.domain.model.TenantBillingRecord;
import com.niigaki.billing.domain.service.SubscriptionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(210)
@Slf4j
@RequiredArgsConstructor
public class SubscriptionCanceledHandler implements WebhookEventHandler {

    private final SubscriptionService subscriptionService;

    @Override
    public boolean supports(AsaasEventType eventType) {
        return eventType == AsaasEventType.SUBSCRIPTION_CANCELED;
    }

    @Override
    public ProcessingResult handle(AsaasEventType eventType, TenantBillingRecord tenant, AsaasWebhookEvent event) {
        String tenantId = tenant.getTenantId();
        if (tenant.getBillingStatus() == BillingStatus.CANCELED) {
            log.debug("Cancellation already applied, syncing instead tenantId={}", tenantId);
            try {
                subscriptionService.sync(tenantId);
            } catch (BillingException e) {
                // the local cancellation stands whatever the processor says
                log.warn("Sync after repeated cancellation failed tenantId={} code={} reason={}",
                        tenantId, e.getCode(), e.getMessage());
            }
            return ProcessingResult.success(eventType.name(), tenantId, "cancellation_already_applied");
        }
        try {
            subscriptionService.applyCancellation(tenantId);
        } catch (InvalidBillingTransitionException e) {
            log.info("Cancellation raced a local change, syncing instead tenantId={} reason={}", tenantId, e.getMessage());
            try {
                subscriptionService.sync(tenantId);
            } catch (InvalidBillingTransitionException syncRejected) {
                log.warn("Processor disagrees with local status tenantId={} reason={}", tenantId, syncRejected.getMessage());
            }
            return ProcessingResult.success(eventType.name(), tenantId, "cancellation_synced");
        }
        return ProcessingResult.success(eventType.name(), tenantId, "tenant_canceled");
    }
}
