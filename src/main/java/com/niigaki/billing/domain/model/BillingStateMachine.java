package com.niigaki.billing.domain.model;

import com.niigaki.billing.domain.exception.InvalidBillingTransitionException;

/**
 * Transition rules for {@link BillingStatus}. Stateless; every check is a lookup in the
 * adjacency table held by the enum.
 */
public final class BillingStateMachine {

    private BillingStateMachine() {
    }

    public static boolean isValidTransition(BillingStatus from, BillingStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return from.canTransitionTo(to);
    }

    /**
     * Validates a move from {@code from} to {@code to}.
     *
     * @return {@code true} when a transition has to be applied, {@code false} when both statuses
     * are equal and there is nothing to do
     * @throws InvalidBillingTransitionException when the pair is not in the adjacency table
     */
    public static boolean requireTransition(BillingStatus from, BillingStatus to) {
        if (from == to) {
            return false;
        }
        if (!isValidTransition(from, to)) {
            throw new InvalidBillingTransitionException(from, to);
        }
        return true;
    }

    public static boolean hasFullAccess(BillingStatus status) {
        return status != null && status.hasFullAccess();
    }

    public static boolean hasLimitedAccess(BillingStatus status) {
        return status != null && status.hasLimitedAccess();
    }

    public static boolean hasAnyAccess(BillingStatus status) {
        return status != null && status.hasAnyAccess();
    }
}
