package com.niigaki.billing.domain.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.OffsetDateTime;

@Document(collection = "tenant_billing")
@Data
public class TenantBillingRecord {

    @Id
    private String tenantId;

    @Indexed(sparse = true)
    private String externalCustomerId;
    @Indexed(sparse = true)
    private String externalSubscriptionId;

    private BillingStatus billingStatus = BillingStatus.PENDING_PAYMENT;
    private SubscriptionMetadata subscriptionMetadata;

    private OffsetDateTime createdAt = OffsetDateTime.now();
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public boolean hasExternalSubscription() {
        return externalSubscriptionId != null && !externalSubscriptionId.isBlank();
    }

    public boolean hasExternalCustomer() {
        return externalCustomerId != null && !externalCustomerId.isBlank();
    }
}
