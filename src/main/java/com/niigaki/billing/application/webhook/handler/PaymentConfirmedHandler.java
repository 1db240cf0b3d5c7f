package com.niigaki.billing.application.webhook.handler;

import com.niigaki.billing.application.webhook.AsaasEventType;
import com.niigaki.billing.application.webhook.AsaasPaymentPayload;
import com.niigaki.billing.application.webhook.AsaasWebhookEvent;
import com.niigaki.billing.application.webhook.WebhookDates;
import com.niigaki.billing.domain.model.ProcessingResult;
import com.niigaki.billing.domain.model.TenantBillingRecord;
import com.niigaki.billing.domain.service.SubscriptionService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;

@Component
@Order(110)
@RequiredArgsConstructor
public class PaymentConfirmedHandler implements WebhookEventHandler {

    private final SubscriptionService subscriptionService;

    @Override
    public boolean supports(AsaasEventType eventType) {
        return eventType == AsaasEventType.PAYMENT_CONFIRMED || eventType == AsaasEventType.PAYMENT_RECEIVED;
    }

    @Override
    public ProcessingResult handle(AsaasEventType eventType, TenantBillingRecord tenant, AsaasWebhookEvent event) {
        subscriptionService.handlePaymentConfirmed(tenant.getTenantId(), resolvePaymentDate(event.payment()));
        return ProcessingResult.success(eventType.name(), tenant.getTenantId(), "tenant_activated");
    }

    private OffsetDateTime resolvePaymentDate(AsaasPaymentPayload payment) {
        for (String candidate : new String[]{payment.confirmedDate(), payment.paymentDate(), payment.clientPaymentDate()}) {
            OffsetDateTime parsed = WebhookDates.parseOffsetDateTime(candidate);
            if (parsed != null) {
                return parsed;
            }
        }
        return OffsetDateTime.now();
    }
}
