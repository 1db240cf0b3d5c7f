package com.niigaki.billing.application.webhook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Inbound webhook body. {@code event} stays a raw string so unknown types can be told apart
 * from known ones by the dispatcher instead of failing deserialization.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AsaasWebhookEvent(
        String id,
        String event,
        AsaasPaymentPayload payment,
        AsaasSubscriptionPayload subscription
) {
}
