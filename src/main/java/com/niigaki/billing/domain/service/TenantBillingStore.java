package com.niigaki.billing.domain.service;

import com.niigaki.billing.domain.model.TenantBillingRecord;
import com.niigaki.billing.domain.model.TenantBillingUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Per-tenant billing record storage. Reads after writes for the same tenant are consistent;
 * nothing spans tenants.
 */
public interface TenantBillingStore {

    Optional<TenantBillingRecord> get(String tenantId);

    /**
     * Applies the non-null fields of {@code update} in one write.
     *
     * @throws com.niigaki.billing.domain.exception.TenantBillingStoreException when the tenant
     *                                                                          is unknown or its status no longer matches {@link TenantBillingUpdate#expectedStatus()}
     */
    void update(String tenantId, TenantBillingUpdate update);

    Optional<TenantBillingRecord> findByExternalSubscriptionId(String externalSubscriptionId);

    Optional<TenantBillingRecord> findByExternalCustomerId(String externalCustomerId);

    List<TenantBillingRecord> findAllWithExternalSubscription();
}
