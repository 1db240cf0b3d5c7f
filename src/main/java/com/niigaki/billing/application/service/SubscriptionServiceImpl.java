package com.niigaki.billing.application.service;

import com.niigaki.billing.application.dto.BillableTenant;
import com.niigaki.billing.application.dto.InitializeSubscriptionCommand;
import com.niigaki.billing.application.dto.InitializeSubscriptionResult;
import com.niigaki.billing.application.dto.ReconciliationSummary;
import com.niigaki.billing.domain.exception.AsaasApiException;
import com.niigaki.billing.domain.exception.CustomerCreationException;
import com.niigaki.billing.domain.exception.InvalidBillingTransitionException;
import com.niigaki.billing.domain.exception.SubscriptionCancellationException;
import com.niigaki.billing.domain.exception.SubscriptionCreationException;
import com.niigaki.billing.domain.exception.TenantBillingNotFoundException;
import com.niigaki.billing.domain.model.BillingPlan;
import com.niigaki.billing.domain.model.BillingStateMachine;
import com.niigaki.billing.domain.model.BillingStatus;
import com.niigaki.billing.domain.model.SubscriptionMetadata;
import com.niigaki.billing.domain.model.TenantBillingRecord;
import com.niigaki.billing.domain.model.TenantBillingUpdate;
import com.niigaki.billing.domain.service.BillingGateway;
import com.niigaki.billing.domain.service.SubscriptionService;
import com.niigaki.billing.domain.service.TenantBillingStore;
import com.niigaki.billing.infrastructure.config.AsaasProperties;
import com.niigaki.billing.infrastructure.config.BillingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

@Service
@Slf4j
public class SubscriptionServiceImpl implements SubscriptionService {

    private final TenantBillingStore tenantBillingStore;
    private final BillingGateway billingGateway;
    private final BillingPlanCatalog billingPlanCatalog;
    private final BillingProperties billingProperties;
    private final AsaasProperties asaasProperties;

    public SubscriptionServiceImpl(TenantBillingStore tenantBillingStore,
                                   BillingGateway billingGateway,
                                   BillingPlanCatalog billingPlanCatalog,
                                   BillingProperties billingProperties,
                                   AsaasProperties asaasProperties) {
        this.tenantBillingStore = tenantBillingStore;
        this.billingGateway = billingGateway;
        this.billingPlanCatalog = billingPlanCatalog;
        this.billingProperties = billingProperties;
        this.asaasProperties = asaasProperties;
    }

    @Override
    public String createCustomerForTenant(BillableTenant tenant) {
        TenantBillingRecord record = requireRecord(tenant.id());
        if (record.hasExternalCustomer()) {
            log.debug("Tenant already bound to customer tenantId={} customerId={}", tenant.id(), record.getExternalCustomerId());
            return record.getExternalCustomerId();
        }

        BillingGateway.CustomerData customer;
        try {
            customer = billingGateway.findCustomerByExternalReference(tenant.id())
                    .orElseGet(() -> billingGateway.createCustomer(new BillingGateway.CustomerRequest(
                            tenant.name(),
                            tenant.email(),
                            tenant.cpfCnpj(),
                            tenant.phone(),
                            tenant.postalCode(),
                            tenant.addressNumber(),
                            tenant.id()
                    )));
        } catch (AsaasApiException e) {
            throw new CustomerCreationException(tenant.id(), "Failed to create customer: " + e.getMessage(), e);
        }

        tenantBillingStore.update(tenant.id(), TenantBillingUpdate.builder()
                .externalCustomerId(customer.id())
                .build());
        log.info("Customer bound to tenant tenantId={} customerId={} gateway={}",
                tenant.id(), customer.id(), billingGateway.gatewayCode());
        return customer.id();
    }

    @Override
    public InitializeSubscriptionResult initializeSubscription(InitializeSubscriptionCommand command) {
        String tenantId = command.tenantId();
        TenantBillingRecord record = requireRecord(tenantId);
        if (!record.hasExternalCustomer()) {
            throw new SubscriptionCreationException(tenantId, null, "Tenant has no customer at the payment processor", null);
        }
        if (record.hasExternalSubscription() && record.getBillingStatus() != BillingStatus.CANCELED) {
            throw new SubscriptionCreationException(tenantId, record.getExternalCustomerId(),
                    "Tenant already has subscription " + record.getExternalSubscriptionId(), null);
        }
        BillingPlan plan = billingPlanCatalog.findById(command.planId())
                .filter(BillingPlan::active)
                .orElseThrow(() -> new SubscriptionCreationException(tenantId, record.getExternalCustomerId(),
                        "Unknown or inactive plan: " + command.planId(), null));

        boolean trial = command.startWithTrial() && plan.offersTrial();
        LocalDate nextDueDate = LocalDate.now(ZoneOffset.UTC).plusDays(trial ? plan.trialDays() : 0);
        String billingType = firstNonBlank(command.billingType(), asaasProperties.getDefaultBillingType());

        BillingGateway.SubscriptionData created;
        try {
            created = billingGateway.createSubscription(new BillingGateway.SubscriptionRequest(
                    record.getExternalCustomerId(),
                    billingType,
                    BigDecimal.valueOf(plan.priceInCents(), 2),
                    nextDueDate,
                    plan.cycle(),
                    "Subscription: " + plan.name(),
                    tenantId
            ));
        } catch (AsaasApiException e) {
            throw new SubscriptionCreationException(tenantId, record.getExternalCustomerId(),
                    "Failed to initialize subscription: " + e.getMessage(), e);
        }

        BillingStatus status = trial ? BillingStatus.TRIAL : BillingStatus.PENDING_PAYMENT;
        SubscriptionMetadata metadata = SubscriptionMetadata.fromPlan(plan);
        if (trial) {
            metadata.setTrialEndDate(nextDueDate);
        }
        metadata.setNextBillingDate(nextDueDate);

        // a new subscription replaces the binding instead of transitioning the old one
        tenantBillingStore.update(tenantId, TenantBillingUpdate.builder()
                .expectedStatus(record.getBillingStatus())
                .billingStatus(status)
                .externalSubscriptionId(created.id())
                .subscriptionMetadata(metadata)
                .build());
        log.info("Subscription initialized tenantId={} subscriptionId={} planId={} status={}",
                tenantId, created.id(), plan.id(), status.getValue());
        return new InitializeSubscriptionResult(created.id(), status, metadata);
    }

    @Override
    public TenantBillingRecord cancelSubscription(String tenantId) {
        TenantBillingRecord record = requireRecord(tenantId);
        if (!record.hasExternalSubscription()) {
            throw new SubscriptionCancellationException(null, "Tenant has no active subscription");
        }
        if (!BillingStateMachine.requireTransition(record.getBillingStatus(), BillingStatus.CANCELED)) {
            log.debug("Subscription already canceled tenantId={}", tenantId);
            return record;
        }

        String subscriptionId = record.getExternalSubscriptionId();
        try {
            BillingGateway.CancellationData cancellation = billingGateway.cancelSubscription(subscriptionId);
            if (!cancellation.deleted()) {
                throw new SubscriptionCancellationException(subscriptionId, "Payment processor did not confirm the cancellation");
            }
        } catch (AsaasApiException e) {
            if (!e.isNotFound()) {
                throw new SubscriptionCancellationException(subscriptionId, "Failed to cancel subscription: " + e.getMessage(), e);
            }
            log.warn("Subscription already gone at processor tenantId={} subscriptionId={}", tenantId, subscriptionId);
        }

        applyStatus(record, BillingStatus.CANCELED, null);
        return requireRecord(tenantId);
    }

    @Override
    public TenantBillingRecord applyCancellation(String tenantId) {
        TenantBillingRecord record = requireRecord(tenantId);
        if (BillingStateMachine.requireTransition(record.getBillingStatus(), BillingStatus.CANCELED)) {
            applyStatus(record, BillingStatus.CANCELED, null);
            return requireRecord(tenantId);
        }
        return record;
    }

    @Override
    public TenantBillingRecord sync(String tenantId) {
        TenantBillingRecord record = requireRecord(tenantId);
        if (!record.hasExternalSubscription()) {
            log.debug("Skipping sync, tenant has no subscription tenantId={}", tenantId);
            return record;
        }

        BillingGateway.SubscriptionData remote = billingGateway.getSubscription(record.getExternalSubscriptionId());
        BillingStatus current = record.getBillingStatus();
        BillingStatus candidate = resolveCandidateStatus(remote, current);

        boolean transition;
        try {
            transition = BillingStateMachine.requireTransition(current, candidate);
        } catch (InvalidBillingTransitionException e) {
            log.error("Sync candidate rejected by state machine tenantId={} subscriptionId={} remoteStatus={} deleted={} from={} to={}",
                    tenantId, remote.id(), remote.status(), remote.deleted(), current.getValue(), candidate.getValue());
            throw e;
        }

        SubscriptionMetadata metadata = null;
        if (remote.nextDueDate() != null) {
            SubscriptionMetadata existing = record.getSubscriptionMetadata();
            if (existing == null || !Objects.equals(existing.getNextBillingDate(), remote.nextDueDate())) {
                metadata = existing == null ? new SubscriptionMetadata() : existing.copy();
                metadata.setNextBillingDate(remote.nextDueDate());
            }
        }

        TenantBillingUpdate.TenantBillingUpdateBuilder update = TenantBillingUpdate.builder().subscriptionMetadata(metadata);
        if (transition) {
            update.expectedStatus(current).billingStatus(candidate);
        }
        TenantBillingUpdate changes = update.build();
        if (changes.isEmpty()) {
            log.debug("Sync found nothing to change tenantId={} status={}", tenantId, current.getValue());
            return record;
        }
        tenantBillingStore.update(tenantId, changes);
        if (transition) {
            log.info("Billing status synced tenantId={} from={} to={} remoteStatus={}",
                    tenantId, current.getValue(), candidate.getValue(), remote.status());
        }
        return requireRecord(tenantId);
    }

    @Override
    public TenantBillingRecord handlePaymentConfirmed(String tenantId, OffsetDateTime paymentDate) {
        TenantBillingRecord record = requireRecord(tenantId);
        SubscriptionMetadata metadata = metadataOf(record);
        metadata.setLastPaymentDate(paymentDate != null ? paymentDate : OffsetDateTime.now());
        metadata.setDaysOverdue(null);

        applyStatus(record, BillingStatus.ACTIVE, metadata);
        return requireRecord(tenantId);
    }

    @Override
    public TenantBillingRecord handlePaymentOverdue(String tenantId, int daysOverdue) {
        TenantBillingRecord record = requireRecord(tenantId);
        BillingStatus target = daysOverdue >= billingProperties.getSuspensionThresholdDays()
                ? BillingStatus.SUSPENDED
                : BillingStatus.OVERDUE;
        SubscriptionMetadata metadata = metadataOf(record);
        metadata.setDaysOverdue(daysOverdue);

        try {
            applyStatus(record, target, metadata);
        } catch (InvalidBillingTransitionException e) {
            // overdue days are recorded even when the status cannot move
            tenantBillingStore.update(tenantId, TenantBillingUpdate.builder().subscriptionMetadata(metadata).build());
            log.warn("Overdue days recorded without status change tenantId={} daysOverdue={} from={} to={}",
                    tenantId, daysOverdue, record.getBillingStatus().getValue(), target.getValue());
            throw e;
        }
        return requireRecord(tenantId);
    }

    @Override
    public ReconciliationSummary runDailyReconciliation() {
        List<TenantBillingRecord> records = tenantBillingStore.findAllWithExternalSubscription();
        int synced = 0;
        int failed = 0;
        for (TenantBillingRecord record : records) {
            try {
                sync(record.getTenantId());
                synced++;
            } catch (Exception e) {
                failed++;
                log.warn("Unable to sync tenant during reconciliation tenantId={} reason={}",
                        record.getTenantId(), e.getMessage());
            }
        }
        log.info("Billing reconciliation finished synced={} failed={}", synced, failed);
        return new ReconciliationSummary(synced, failed);
    }

    BillingStatus resolveCandidateStatus(BillingGateway.SubscriptionData remote, BillingStatus current) {
        if (remote.deleted()) {
            return BillingStatus.CANCELED;
        }
        String status = remote.status() == null ? "" : remote.status().trim().toUpperCase(Locale.ROOT);
        return switch (status) {
            case "ACTIVE" -> billingProperties.isKeepLocalStatusOnRemoteActive()
                    && (current == BillingStatus.TRIAL || current == BillingStatus.PENDING_PAYMENT)
                    ? current
                    : BillingStatus.ACTIVE;
            case "INACTIVE" -> BillingStatus.SUSPENDED;
            case "EXPIRED" -> BillingStatus.CANCELED;
            default -> current;
        };
    }

    private void applyStatus(TenantBillingRecord record, BillingStatus target, SubscriptionMetadata metadata) {
        BillingStatus current = record.getBillingStatus();
        boolean transition = BillingStateMachine.requireTransition(current, target);

        TenantBillingUpdate.TenantBillingUpdateBuilder update = TenantBillingUpdate.builder().subscriptionMetadata(metadata);
        if (transition) {
            update.expectedStatus(current).billingStatus(target);
        }
        TenantBillingUpdate changes = update.build();
        if (changes.isEmpty()) {
            return;
        }
        tenantBillingStore.update(record.getTenantId(), changes);
        if (transition) {
            log.info("Billing status changed tenantId={} from={} to={}",
                    record.getTenantId(), current.getValue(), target.getValue());
        }
    }

    private TenantBillingRecord requireRecord(String tenantId) {
        return tenantBillingStore.get(tenantId)
                .orElseThrow(() -> new TenantBillingNotFoundException(tenantId));
    }

    private SubscriptionMetadata metadataOf(TenantBillingRecord record) {
        SubscriptionMetadata metadata = record.getSubscriptionMetadata();
        return metadata == null ? new SubscriptionMetadata() : metadata.copy();
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
