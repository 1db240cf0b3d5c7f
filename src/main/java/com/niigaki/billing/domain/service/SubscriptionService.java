package com.niigaki.billing.domain.service;

import com.niigaki.billing.application.dto.BillableTenant;
import com.niigaki.billing.application.dto.InitializeSubscriptionCommand;
import com.niigaki.billing.application.dto.InitializeSubscriptionResult;
import com.niigaki.billing.application.dto.ReconciliationSummary;
import com.niigaki.billing.domain.model.TenantBillingRecord;

import java.time.OffsetDateTime;

/**
 * Owns every change to a tenant's billing record. Status changes go through the billing state
 * machine and land in a single store write together with their metadata.
 */
public interface SubscriptionService {

    String createCustomerForTenant(BillableTenant tenant);

    InitializeSubscriptionResult initializeSubscription(InitializeSubscriptionCommand command);

    /**
     * Cancels the tenant's subscription at the processor, then locally.
     */
    TenantBillingRecord cancelSubscription(String tenantId);

    /**
     * Records a cancellation that already happened at the processor.
     */
    TenantBillingRecord applyCancellation(String tenantId);

    /**
     * Merges the processor's current view of the tenant's subscription into the local record.
     */
    TenantBillingRecord sync(String tenantId);

    TenantBillingRecord handlePaymentConfirmed(String tenantId, OffsetDateTime paymentDate);

    TenantBillingRecord handlePaymentOverdue(String tenantId, int daysOverdue);

    ReconciliationSummary runDailyReconciliation();
}
