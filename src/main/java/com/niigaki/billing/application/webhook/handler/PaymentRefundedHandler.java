package com.niigaki.billing.application.webhook.handler;

import com.niigaki.billing.application.webhook.AsaasEventType;
import com.niigaki.billing.application.webhook.AsaasPaymentPayload;
import com.niigaki.billing.application.webhook.AsaasWebhookEvent;
import com.niigaki.billing.domain.model.ProcessingResult;
import com.niigaki.billing.domain.model.TenantBillingRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Refunds are recorded only. Whether a refund should downgrade the tenant is a product decision
 * that has not been made yet.
 */
@Component
@Order(130)
@Slf4j
public class PaymentRefundedHandler implements WebhookEventHandler {

    @Override
    public boolean supports(AsaasEventType eventType) {
        return eventType == AsaasEventType.PAYMENT_REFUNDED;
    }

    @Override
    public ProcessingResult handle(AsaasEventType eventType, TenantBillingRecord tenant, AsaasWebhookEvent event) {
        AsaasPaymentPayload payment = event.payment();
        log.info("Payment refunded tenantId={} paymentId={} value={} status={}",
                tenant.getTenantId(), payment.id(), payment.value(), tenant.getBillingStatus().getValue());
        return ProcessingResult.success(eventType.name(), tenant.getTenantId(), "refund_registered");
    }
}
