package com.niigaki.billing.application.webhook.handler;

import com.niigaki.billing.application.webhook.AsaasEventType;
import com.niigaki.billing.application.webhook.AsaasPaymentPayload;
import com.niigaki.billing.application.webhook.AsaasWebhookEvent;
import com.niigaki.billing.application.webhook.WebhookDates;
import com.niigaki.billing.domain.exception.WebhookInvalidException;
import com.niigaki.billing.domain.model.BillingStatus;
import com.niigaki.billing.domain.model.ProcessingResult;
import com.niigaki.billing.domain.model.TenantBillingRecord;
import com.niigaki.billing.domain.service.SubscriptionService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Component
@Order(120)
@RequiredArgsConstructor
public class PaymentOverdueHandler implements WebhookEventHandler {

    private final SubscriptionService subscriptionService;

    @Override
    public boolean supports(AsaasEventType eventType) {
        return eventType == AsaasEventType.PAYMENT_OVERDUE;
    }

    @Override
    public ProcessingResult handle(AsaasEventType eventType, TenantBillingRecord tenant, AsaasWebhookEvent event) {
        AsaasPaymentPayload payment = event.payment();
        LocalDate dueDate = WebhookDates.parseLocalDate(payment.dueDate());
        if (dueDate == null) {
            throw new WebhookInvalidException("Overdue payment " + payment.id() + " has no valid dueDate", eventType.name());
        }
        int daysOverdue = WebhookDates.daysSince(dueDate, OffsetDateTime.now());

        TenantBillingRecord updated = subscriptionService.handlePaymentOverdue(tenant.getTenantId(), daysOverdue);
        String action = updated.getBillingStatus() == BillingStatus.SUSPENDED ? "tenant_suspended" : "tenant_overdue";
        return ProcessingResult.success(eventType.name(), tenant.getTenantId(), action);
    }
}
