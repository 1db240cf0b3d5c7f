package com.niigaki.billing.domain.model;

import java.util.Locale;

public enum BillingCycle {
    WEEKLY(7),
    BIWEEKLY(14),
    MONTHLY(30),
    QUARTERLY(90),
    SEMIANNUALLY(180),
    YEARLY(365);

    private final int approximateDays;

    BillingCycle(int approximateDays) {
        this.approximateDays = approximateDays;
    }

    public int getApproximateDays() {
        return approximateDays;
    }

    public static boolean isBillingCycle(String raw) {
        if (raw == null) {
            return false;
        }
        try {
            valueOf(raw.trim().toUpperCase(Locale.ROOT));
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
