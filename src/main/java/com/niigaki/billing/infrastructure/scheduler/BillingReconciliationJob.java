package com.niigaki.billing.infrastructure.scheduler;

import com.niigaki.billing.domain.service.SubscriptionService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "niigaki.billing", name = "scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class BillingReconciliationJob {

    private final SubscriptionService subscriptionService;

    public BillingReconciliationJob(SubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    @Scheduled(cron = "${niigaki.billing.reconciliation-cron:0 0 3 * * *}")
    public void reconcileDaily() {
        subscriptionService.runDailyReconciliation();
    }
}
