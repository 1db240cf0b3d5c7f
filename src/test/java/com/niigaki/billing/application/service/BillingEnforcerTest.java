package com.niigaki.billing.application.service;

import com.niigaki.billing.domain.exception.BillingStatusInvalidException;
import com.niigaki.billing.domain.model.BillingStatus;
import com.niigaki.billing.support.InMemoryTenantBillingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BillingEnforcerTest {

    private InMemoryTenantBillingStore store;
    private BillingEnforcer enforcer;

    @BeforeEach
    void setUp() {
        store = new InMemoryTenantBillingStore();
        enforcer = new BillingEnforcer(store);
    }

    @Test
    void requireActive_allowsActiveAndTrial() {
        store.put("active", BillingStatus.ACTIVE);
        store.put("trial", BillingStatus.TRIAL);

        assertThat(enforcer.requireActive("active")).isTrue();
        assertThat(enforcer.requireActive("trial")).isTrue();
    }

    @Test
    void requireActive_overdueThrowsWithRequiredStatuses() {
        store.put("t1", BillingStatus.OVERDUE);

        assertThatThrownBy(() -> enforcer.requireActive("t1"))
                .isInstanceOf(BillingStatusInvalidException.class)
                .satisfies(e -> {
                    BillingStatusInvalidException ex = (BillingStatusInvalidException) e;
                    assertThat(ex.getCurrentStatus()).isEqualTo(BillingStatus.OVERDUE);
                    assertThat(ex.getRequiredStatuses()).containsExactly(BillingStatus.ACTIVE, BillingStatus.TRIAL);
                });
    }

    @Test
    void requireAnyAccess_allowsLimitedAccessButNotSuspended() {
        store.put("overdue", BillingStatus.OVERDUE);
        store.put("pending", BillingStatus.PENDING_PAYMENT);
        store.put("suspended", BillingStatus.SUSPENDED);

        assertThat(enforcer.requireAnyAccess("overdue")).isTrue();
        assertThat(enforcer.requireAnyAccess("pending")).isTrue();
        assertThatThrownBy(() -> enforcer.requireAnyAccess("suspended"))
                .isInstanceOf(BillingStatusInvalidException.class);
    }

    @Test
    void unknownTenant_isDeniedAsCanceled() {
        assertThatThrownBy(() -> enforcer.requireAnyAccess("ghost"))
                .isInstanceOf(BillingStatusInvalidException.class)
                .satisfies(e -> assertThat(((BillingStatusInvalidException) e).getCurrentStatus())
                        .isEqualTo(BillingStatus.CANCELED));
        assertThat(enforcer.isSuspendedOrCanceled("ghost")).isTrue();
        assertThat(enforcer.getBillingContext("ghost")).isEmpty();
        assertThat(enforcer.getBillingStatus("ghost")).isEmpty();
    }

    @Test
    void nonThrowingEnforcer_answersFalse() {
        BillingEnforcer lenient = new BillingEnforcer(store, false);
        store.put("t1", BillingStatus.CANCELED);

        assertThat(lenient.requireActive("t1")).isFalse();
        assertThat(lenient.requireAnyAccess("t1")).isFalse();
        assertThat(lenient.requireAnyAccess("ghost")).isFalse();
    }

    @Test
    void statusQueries_reflectStoredStatus() {
        store.put("trial", BillingStatus.TRIAL);
        store.put("overdue", BillingStatus.OVERDUE);
        store.put("suspended", BillingStatus.SUSPENDED);

        assertThat(enforcer.inTrial("trial")).isTrue();
        assertThat(enforcer.inTrial("overdue")).isFalse();
        assertThat(enforcer.hasLimitedAccessOnly("overdue")).isTrue();
        assertThat(enforcer.hasLimitedAccessOnly("trial")).isFalse();
        assertThat(enforcer.isSuspendedOrCanceled("suspended")).isTrue();
        assertThat(enforcer.isSuspendedOrCanceled("trial")).isFalse();
        assertThat(enforcer.getBillingContext("overdue")).get()
                .satisfies(context -> assertThat(context.isOverdue()).isTrue());
    }
}
