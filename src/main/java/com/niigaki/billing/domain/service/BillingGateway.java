package com.niigaki.billing.domain.service;

import com.niigaki.billing.domain.model.BillingCycle;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Typed client for the payment processor. Implementations translate transport failures into
 * {@link com.niigaki.billing.domain.exception.AsaasApiException}.
 */
public interface BillingGateway {

    default String gatewayCode() {
        return "UNKNOWN";
    }

    CustomerData createCustomer(CustomerRequest request);

    Optional<CustomerData> findCustomerByExternalReference(String externalReference);

    SubscriptionData createSubscription(SubscriptionRequest request);

    SubscriptionData getSubscription(String subscriptionId);

    CancellationData cancelSubscription(String subscriptionId);

    record CustomerRequest(
            String name,
            String email,
            String cpfCnpj,
            String phone,
            String postalCode,
            String addressNumber,
            String externalReference
    ) {
    }

    record CustomerData(
            String id,
            String name,
            String email,
            String externalReference
    ) {
    }

    record SubscriptionRequest(
            String customerId,
            String billingType,
            BigDecimal value,
            LocalDate nextDueDate,
            BillingCycle cycle,
            String description,
            String externalReference
    ) {
    }

    /**
     * Remote view of a subscription. {@code status} is the processor's raw value
     * ({@code ACTIVE}, {@code INACTIVE}, {@code EXPIRED}, ...).
     */
    record SubscriptionData(
            String id,
            String customerId,
            String status,
            boolean deleted,
            LocalDate nextDueDate,
            BigDecimal value,
            String externalReference
    ) {
    }

    record CancellationData(
            String id,
            boolean deleted
    ) {
    }
}
