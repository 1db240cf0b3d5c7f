package com.niigaki.billing.infrastructure.persistence;

import com.mongodb.client.result.UpdateResult;
import com.niigaki.billing.domain.exception.TenantBillingNotFoundException;
import com.niigaki.billing.domain.exception.TenantBillingStoreException;
import com.niigaki.billing.domain.model.TenantBillingRecord;
import com.niigaki.billing.domain.model.TenantBillingUpdate;
import com.niigaki.billing.domain.repository.TenantBillingRepository;
import com.niigaki.billing.domain.service.TenantBillingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class MongoTenantBillingStore implements TenantBillingStore {

    private final TenantBillingRepository tenantBillingRepository;
    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<TenantBillingRecord> get(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            return Optional.empty();
        }
        try {
            return tenantBillingRepository.findById(tenantId);
        } catch (DataAccessException e) {
            throw new TenantBillingStoreException(tenantId, "Failed to read tenant billing record", e);
        }
    }

    @Override
    public void update(String tenantId, TenantBillingUpdate update) {
        Query query = Query.query(Criteria.where("tenantId").is(tenantId));
        boolean guarded = update.billingStatus() != null && update.expectedStatus() != null;
        if (guarded) {
            query.addCriteria(Criteria.where("billingStatus").is(update.expectedStatus()));
        }

        Update changes = new Update().set("updatedAt", OffsetDateTime.now());
        if (update.billingStatus() != null) {
            changes.set("billingStatus", update.billingStatus());
        }
        if (update.subscriptionMetadata() != null) {
            changes.set("subscriptionMetadata", update.subscriptionMetadata());
        }
        if (update.externalCustomerId() != null) {
            changes.set("externalCustomerId", update.externalCustomerId());
        }
        if (update.externalSubscriptionId() != null) {
            changes.set("externalSubscriptionId", update.externalSubscriptionId());
        }

        UpdateResult result;
        try {
            result = mongoTemplate.updateFirst(query, changes, TenantBillingRecord.class);
        } catch (DataAccessException e) {
            throw new TenantBillingStoreException(tenantId, "Failed to update tenant billing record", e);
        }

        if (result.getMatchedCount() == 0) {
            if (!tenantBillingRepository.existsById(tenantId)) {
                throw new TenantBillingNotFoundException(tenantId);
            }
            log.warn("Billing status changed concurrently tenantId={} expected={} target={}",
                    tenantId, update.expectedStatus(), update.billingStatus());
            throw new TenantBillingStoreException(tenantId,
                    "Billing status is no longer " + update.expectedStatus() + " for tenant " + tenantId);
        }
        log.debug("Tenant billing updated tenantId={} status={}", tenantId, update.billingStatus());
    }

    @Override
    public Optional<TenantBillingRecord> findByExternalSubscriptionId(String externalSubscriptionId) {
        return tenantBillingRepository.findFirstByExternalSubscriptionId(externalSubscriptionId);
    }

    @Override
    public Optional<TenantBillingRecord> findByExternalCustomerId(String externalCustomerId) {
        return tenantBillingRepository.findFirstByExternalCustomerId(externalCustomerId);
    }

    @Override
    public List<TenantBillingRecord> findAllWithExternalSubscription() {
        return tenantBillingRepository.findByExternalSubscriptionIdIsNotNull();
    }
}
