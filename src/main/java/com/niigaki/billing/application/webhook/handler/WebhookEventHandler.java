package com.niigaki.billing.application.webhook.handler;

import com.niigaki.billing.application.webhook.AsaasEventType;
import com.niigaki.billing.application.webhook.AsaasWebhookEvent;
import com.niigaki.billing.domain.model.ProcessingResult;
import com.niigaki.billing.domain.model.TenantBillingRecord;

/**
 * Applies one kind of processor event to an already resolved tenant. A handler performs at
 * most one status transition.
 */
public interface WebhookEventHandler {

    boolean supports(AsaasEventType eventType);

    ProcessingResult handle(AsaasEventType eventType, TenantBillingRecord tenant, AsaasWebhookEvent event);
}
