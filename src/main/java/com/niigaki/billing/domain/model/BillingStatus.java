package com.niigaki.billing.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Billing lifecycle of a tenant.
 * <p>
 * Legal moves are fixed by {@link #allowedTargets()}. {@link #CANCELED} is terminal: a tenant
 * that wants to come back needs a new subscription, not a transition.
 */
public enum BillingStatus {
    TRIAL("trial"),
    PENDING_PAYMENT("pending_payment"),
    ACTIVE("active"),
    OVERDUE("overdue"),
    SUSPENDED("suspended"),
    CANCELED("canceled");

    private static final Map<BillingStatus, Set<BillingStatus>> TRANSITIONS = new EnumMap<>(BillingStatus.class);

    static {
        TRANSITIONS.put(TRIAL, EnumSet.of(ACTIVE, PENDING_PAYMENT, CANCELED));
        TRANSITIONS.put(PENDING_PAYMENT, EnumSet.of(ACTIVE, OVERDUE, CANCELED));
        TRANSITIONS.put(ACTIVE, EnumSet.of(OVERDUE, CANCELED));
        TRANSITIONS.put(OVERDUE, EnumSet.of(ACTIVE, SUSPENDED, CANCELED));
        TRANSITIONS.put(SUSPENDED, EnumSet.of(ACTIVE, CANCELED));
        TRANSITIONS.put(CANCELED, EnumSet.noneOf(BillingStatus.class));
    }

    private final String value;

    BillingStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Set<BillingStatus> allowedTargets() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canTransitionTo(BillingStatus target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    public boolean hasFullAccess() {
        return this == ACTIVE || this == TRIAL;
    }

    public boolean hasLimitedAccess() {
        return this == OVERDUE || this == PENDING_PAYMENT;
    }

    public boolean hasAnyAccess() {
        return hasFullAccess() || hasLimitedAccess();
    }

    @JsonCreator
    public static BillingStatus fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Billing status must not be null");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (BillingStatus status : values()) {
            if (status.value.equals(normalized) || status.name().equalsIgnoreCase(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown billing status: " + raw);
    }

    public static boolean isBillingStatus(String raw) {
        try {
            fromValue(raw);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
