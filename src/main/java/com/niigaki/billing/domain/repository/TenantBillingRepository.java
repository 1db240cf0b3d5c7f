package com.niigaki.billing.domain.repository;

import com.niigaki.billing.domain.model.TenantBillingRecord;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface TenantBillingRepository extends MongoRepository<TenantBillingRecord, String> {

    Optional<TenantBillingRecord> findFirstByExternalSubscriptionId(String externalSubscriptionId);

    Optional<TenantBillingRecord> findFirstByExternalCustomerId(String externalCustomerId);

    List<TenantBillingRecord> findByExternalSubscriptionIdIsNotNull();
}
