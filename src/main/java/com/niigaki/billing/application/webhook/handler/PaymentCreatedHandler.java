package com.niigaki.billing.application.webhook.handler;

import com.niigaki.billing.application.webhook.AsaasEventType;
import com.niigaki.billing.application.webhook.AsaasPaymentPayload;
import com.niigaki.billing.application.webhook.AsaasWebhookEvent;
import com.niigaki.billing.domain.model.ProcessingResult;
import com.niigaki.billing.domain.model.TenantBillingRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(100)
@Slf4j
public class PaymentCreatedHandler implements WebhookEventHandler {

    @Override
    public boolean supports(AsaasEventType eventType) {
        return eventType == AsaasEventType.PAYMENT_CREATED;
    }

    @Override
    public ProcessingResult handle(AsaasEventType eventType, TenantBillingRecord tenant, AsaasWebhookEvent event) {
        AsaasPaymentPayload payment = event.payment();
        log.info("Payment created tenantId={} paymentId={} value={} dueDate={}",
                tenant.getTenantId(), payment.id(), payment.value(), payment.dueDate());
        return ProcessingResult.success(eventType.name(), tenant.getTenantId(), "payment_registered");
    }
}
