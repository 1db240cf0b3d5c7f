package com.niigaki.billing.application.webhook;

import com.niigaki.billing.application.webhook.handler.WebhookEventHandler;
import com.niigaki.billing.domain.exception.BillingException;
import com.niigaki.billing.domain.exception.WebhookInvalidException;
import com.niigaki.billing.domain.model.ProcessingResult;
import com.niigaki.billing.domain.model.TenantBillingRecord;
import com.niigaki.billing.domain.service.TenantBillingStore;
import com.niigaki.billing.infrastructure.config.AsaasProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Optional;

/**
 * Classifies processor events, resolves the owning tenant and routes to the matching
 * {@link WebhookEventHandler}.
 * <p>
 * Never throws for a processing problem: every failure comes back as a
 * {@link ProcessingResult} with {@code success=false} so ledger bookkeeping always runs.
 */
@Component
@Slf4j
public class WebhookEventDispatcher {

    private final List<WebhookEventHandler> handlers;
    private final TenantBillingStore tenantBillingStore;
    private final AsaasProperties asaasProperties;

    public WebhookEventDispatcher(List<WebhookEventHandler> handlers,
                                  TenantBillingStore tenantBillingStore,
                                  AsaasProperties asaasProperties) {
        this.handlers = handlers;
        this.tenantBillingStore = tenantBillingStore;
        this.asaasProperties = asaasProperties;
    }

    public boolean isAccessTokenValid(String accessToken) {
        String configuredToken = trimToNull(asaasProperties.getWebhookToken());
        if (configuredToken == null) {
            return true;
        }
        String provided = trimToNull(accessToken);
        if (provided == null) {
            return false;
        }
        return MessageDigest.isEqual(
                configuredToken.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8)
        );
    }

    /**
     * Dispatches an event whose origin has already been verified, e.g. a ledger replay.
     */
    public ProcessingResult dispatch(AsaasWebhookEvent event) {
        String rawType = event.event();
        String tenantId = null;
        try {
            AsaasEventType type = AsaasEventType.fromValue(rawType)
                    .orElseThrow(() -> new WebhookInvalidException("Unknown event type: " + rawType, rawType));

            if (type.category() == AsaasEventType.Category.OTHER) {
                log.debug("Acknowledging unmodeled Asaas event eventType={}", type);
                return ProcessingResult.ignored(type.name());
            }

            Optional<TenantBillingRecord> tenant = resolveTenant(type, event);
            if (tenant.isEmpty()) {
                log.info("No tenant for Asaas event eventType={} eventId={}", type, event.id());
                return ProcessingResult.tenantNotFound(type.name());
            }
            tenantId = tenant.get().getTenantId();

            ProcessingResult result = route(type, tenant.get(), event);
            log.info("Asaas event handled eventType={} tenantId={} action={}", type, tenantId, result.action());
            return result;
        } catch (BillingException e) {
            log.warn("Asaas event failed eventType={} tenantId={} code={} reason={}",
                    rawType, tenantId, e.getCode(), e.getMessage());
            return ProcessingResult.failure(rawType, tenantId, e.getMessage(), e.isRetryable());
        } catch (RuntimeException e) {
            log.error("Unexpected failure handling Asaas event eventType={} tenantId={}", rawType, tenantId, e);
            return ProcessingResult.failure(rawType, tenantId, e.getMessage(), true);
        }
    }

    private Optional<TenantBillingRecord> resolveTenant(AsaasEventType type, AsaasWebhookEvent event) {
        return switch (type.category()) {
            case PAYMENT -> {
                AsaasPaymentPayload payment = event.payment();
                if (payment == null) {
                    throw new WebhookInvalidException("Payment payload is required for payment events", type.name());
                }
                yield resolveTenant(payment.subscription(), payment.customer());
            }
            case SUBSCRIPTION -> {
                AsaasSubscriptionPayload subscription = event.subscription();
                if (subscription == null) {
                    throw new WebhookInvalidException("Subscription payload is required for subscription events", type.name());
                }
                yield resolveTenant(subscription.id(), subscription.customer());
            }
            case OTHER -> Optional.empty();
        };
    }

    private Optional<TenantBillingRecord> resolveTenant(String subscriptionId, String customerId) {
        Optional<TenantBillingRecord> bySubscription = Optional.empty();
        if (trimToNull(subscriptionId) != null) {
            bySubscription = tenantBillingStore.findByExternalSubscriptionId(subscriptionId);
        }
        if (bySubscription.isPresent() || trimToNull(customerId) == null) {
            return bySubscription;
        }
        return tenantBillingStore.findByExternalCustomerId(customerId);
    }

    private ProcessingResult route(AsaasEventType type, TenantBillingRecord tenant, AsaasWebhookEvent event) {
        for (WebhookEventHandler handler : handlers) {
            if (handler.supports(type)) {
                return handler.handle(type, tenant, event);
            }
        }
        String action = type.isPaymentEvent() ? "payment_event_ignored" : "subscription_event_ignored";
        return ProcessingResult.success(type.name(), tenant.getTenantId(), action);
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
