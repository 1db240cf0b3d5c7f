package com.niigaki.billing.infrastructure.config;

import com.niigaki.billing.domain.model.BillingCycle;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "niigaki.billing")
@Data
public class BillingProperties {

    private int suspensionThresholdDays = 15;
    /**
     * When the processor reports an ACTIVE subscription, tenants still in trial or waiting for
     * their first payment keep their local status.
     */
    private boolean keepLocalStatusOnRemoteActive = true;
    private String webhookSource = "asaas";
    private int webhookMaxAttempts = 3;
    private int retryBatchSize = 50;
    private Duration processingStaleAfter = Duration.ofMinutes(10);
    private String retryCron = "0 */5 * * * *";
    private String reconciliationCron = "0 0 3 * * *";
    private boolean schedulerEnabled = true;
    private List<Plan> plans = new ArrayList<>();

    @Data
    public static class Plan {
        private String id;
        private String name;
        private String description;
        private long priceInCents;
        private String currency = "BRL";
        private BillingCycle cycle = BillingCycle.MONTHLY;
        private int trialDays;
        private List<String> features = new ArrayList<>();
        private boolean active = true;
    }
}
