package com.niigaki.billing.infrastructure.web;

import com.niigaki.billing.application.service.BillingPlanCatalog;
import com.niigaki.billing.domain.model.BillingPlan;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/billing/plans")
@RequiredArgsConstructor
public class BillingPlanController {

    private final BillingPlanCatalog billingPlanCatalog;

    @GetMapping
    public List<BillingPlan> activePlans() {
        return billingPlanCatalog.activePlans();
    }
}
