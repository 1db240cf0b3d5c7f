package com.niigaki.billing.application.service;

import com.niigaki.billing.domain.model.BillingPlan;
import com.niigaki.billing.infrastructure.config.BillingProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class BillingPlanCatalog {

    private final Map<String, BillingPlan> plansById = new LinkedHashMap<>();

    public BillingPlanCatalog(BillingProperties billingProperties) {
        for (BillingProperties.Plan plan : billingProperties.getPlans()) {
            plansById.put(plan.getId(), new BillingPlan(
                    plan.getId(),
                    plan.getName(),
                    plan.getDescription(),
                    plan.getPriceInCents(),
                    plan.getCurrency(),
                    plan.getCycle(),
                    plan.getTrialDays(),
                    plan.getFeatures(),
                    plan.isActive()
            ));
        }
    }

    public Optional<BillingPlan> findById(String planId) {
        if (planId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(plansById.get(planId));
    }

    public List<BillingPlan> activePlans() {
        return plansById.values().stream()
                .filter(BillingPlan::active)
                .toList();
    }
}
