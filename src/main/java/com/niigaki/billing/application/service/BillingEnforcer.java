package com.niigaki.billing.application.service;

import com.niigaki.billing.application.dto.AccessContext;
import com.niigaki.billing.domain.exception.BillingStatusInvalidException;
import com.niigaki.billing.domain.model.BillingStateMachine;
import com.niigaki.billing.domain.model.BillingStatus;
import com.niigaki.billing.domain.model.TenantBillingRecord;
import com.niigaki.billing.domain.service.TenantBillingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Billing checks consumed by the platform's authorization layer.
 * <p>
 * With {@code throwOnDenial} set, the {@code require*} methods raise
 * {@link BillingStatusInvalidException}; otherwise they answer {@code false}. Unknown tenants are
 * treated as canceled.
 */
@Service
@Slf4j
public class BillingEnforcer {

    private static final List<BillingStatus> FULL_ACCESS_STATUSES = List.of(BillingStatus.ACTIVE, BillingStatus.TRIAL);
    private static final List<BillingStatus> ANY_ACCESS_STATUSES = List.of(
            BillingStatus.ACTIVE, BillingStatus.TRIAL, BillingStatus.OVERDUE, BillingStatus.PENDING_PAYMENT
    );

    private final TenantBillingStore tenantBillingStore;
    private final boolean throwOnDenial;

    @Autowired
    public BillingEnforcer(TenantBillingStore tenantBillingStore) {
        this(tenantBillingStore, true);
    }

    public BillingEnforcer(TenantBillingStore tenantBillingStore, boolean throwOnDenial) {
        this.tenantBillingStore = tenantBillingStore;
        this.throwOnDenial = throwOnDenial;
    }

    public Optional<AccessContext> getBillingContext(String tenantId) {
        return tenantBillingStore.get(tenantId).map(BillingAccessProjection::project);
    }

    public boolean requireActive(String tenantId) {
        Optional<TenantBillingRecord> record = tenantBillingStore.get(tenantId);
        if (record.isEmpty()) {
            return deny(tenantId, BillingStatus.CANCELED, "Tenant not found", FULL_ACCESS_STATUSES);
        }
        BillingStatus status = record.get().getBillingStatus();
        if (!BillingStateMachine.hasFullAccess(status)) {
            return deny(tenantId, status,
                    "Tenant billing status is '" + status.getValue() + "', but 'active' or 'trial' is required",
                    FULL_ACCESS_STATUSES);
        }
        return true;
    }

    public boolean requireAnyAccess(String tenantId) {
        Optional<TenantBillingRecord> record = tenantBillingStore.get(tenantId);
        if (record.isEmpty()) {
            return deny(tenantId, BillingStatus.CANCELED, "Tenant not found", ANY_ACCESS_STATUSES);
        }
        BillingStatus status = record.get().getBillingStatus();
        if (!BillingStateMachine.hasAnyAccess(status)) {
            return deny(tenantId, status,
                    "Tenant access is denied due to billing status '" + status.getValue() + "'",
                    ANY_ACCESS_STATUSES);
        }
        return true;
    }

    public boolean inTrial(String tenantId) {
        return getBillingStatus(tenantId).map(status -> status == BillingStatus.TRIAL).orElse(false);
    }

    public boolean hasLimitedAccessOnly(String tenantId) {
        return getBillingStatus(tenantId).map(BillingStateMachine::hasLimitedAccess).orElse(false);
    }

    public boolean isSuspendedOrCanceled(String tenantId) {
        return getBillingStatus(tenantId)
                .map(status -> status == BillingStatus.SUSPENDED || status == BillingStatus.CANCELED)
                .orElse(true);
    }

    public Optional<BillingStatus> getBillingStatus(String tenantId) {
        return tenantBillingStore.get(tenantId).map(TenantBillingRecord::getBillingStatus);
    }

    private boolean deny(String tenantId, BillingStatus current, String message, List<BillingStatus> required) {
        log.debug("Billing access denied tenantId={} status={}", tenantId, current.getValue());
        if (throwOnDenial) {
            throw new BillingStatusInvalidException(current, message, required);
        }
        return false;
    }
}
