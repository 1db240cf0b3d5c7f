package com.niigaki.billing.application.webhook;

import java.util.List;
import java.util.Optional;

/**
 * Every event the Asaas webhook API can deliver.
 */
public enum AsaasEventType {
    PAYMENT_CREATED,
    PAYMENT_AWAITING_RISK_ANALYSIS,
    PAYMENT_APPROVED_BY_RISK_ANALYSIS,
    PAYMENT_REPROVED_BY_RISK_ANALYSIS,
    PAYMENT_UPDATED,
    PAYMENT_CONFIRMED,
    PAYMENT_RECEIVED,
    PAYMENT_ANTICIPATED,
    PAYMENT_OVERDUE,
    PAYMENT_DELETED,
    PAYMENT_RESTORED,
    PAYMENT_REFUNDED,
    PAYMENT_RECEIVED_IN_CASH_UNDONE,
    PAYMENT_CHARGEBACK_REQUESTED,
    PAYMENT_CHARGEBACK_DISPUTE,
    PAYMENT_AWAITING_CHARGEBACK_REVERSAL,
    PAYMENT_DUNNING_RECEIVED,
    PAYMENT_DUNNING_REQUESTED,

    SUBSCRIPTION_CREATED,
    SUBSCRIPTION_ACTIVATED,
    SUBSCRIPTION_UPDATED,
    SUBSCRIPTION_CANCELED,
    SUBSCRIPTION_RENEWED,

    TRANSFER_CREATED,
    TRANSFER_PENDING,
    TRANSFER_IN_BANK_PROCESSING,
    TRANSFER_BLOCKED,
    TRANSFER_DONE,
    TRANSFER_FAILED,
    TRANSFER_CANCELLED,

    INVOICE_CREATED,
    INVOICE_UPDATED,
    INVOICE_SYNCHRONIZED,
    INVOICE_AUTHORIZED,
    INVOICE_PROCESSING_CANCELLATION,
    INVOICE_CANCELED,
    INVOICE_CANCELLATION_DENIED,
    INVOICE_ERROR;

    /**
     * Events that have to be enabled on the Asaas webhook configuration for billing status to
     * stay accurate.
     */
    public static final List<AsaasEventType> REQUIRED_EVENTS = List.of(
            PAYMENT_CREATED,
            PAYMENT_CONFIRMED,
            PAYMENT_RECEIVED,
            PAYMENT_OVERDUE,
            PAYMENT_REFUNDED,
            SUBSCRIPTION_ACTIVATED,
            SUBSCRIPTION_CANCELED
    );

    public enum Category {
        PAYMENT,
        SUBSCRIPTION,
        OTHER
    }

    public Category category() {
        if (name().startsWith("PAYMENT_")) {
            return Category.PAYMENT;
        }
        if (name().startsWith("SUBSCRIPTION_")) {
            return Category.SUBSCRIPTION;
        }
        return Category.OTHER;
    }

    public boolean isPaymentEvent() {
        return category() == Category.PAYMENT;
    }

    public boolean isSubscriptionEvent() {
        return category() == Category.SUBSCRIPTION;
    }

    public static Optional<AsaasEventType> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (AsaasEventType type : values()) {
            if (type.name().equals(value.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
