package com.niigaki.billing.infrastructure.web;

import com.niigaki.billing.application.dto.AccessContext;
import com.niigaki.billing.application.dto.BillableTenant;
import com.niigaki.billing.application.dto.InitializeSubscriptionCommand;
import com.niigaki.billing.application.dto.InitializeSubscriptionResult;
import com.niigaki.billing.application.service.BillingAccessProjection;
import com.niigaki.billing.application.service.BillingEnforcer;
import com.niigaki.billing.domain.exception.TenantBillingNotFoundException;
import com.niigaki.billing.domain.service.SubscriptionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tenants/{tenantId}/billing")
@RequiredArgsConstructor
public class TenantBillingController {

    private final BillingEnforcer billingEnforcer;
    private final SubscriptionService subscriptionService;

    @GetMapping("/access")
    public AccessContext access(@PathVariable String tenantId) {
        return billingEnforcer.getBillingContext(tenantId)
                .orElseThrow(() -> new TenantBillingNotFoundException(tenantId));
    }

    @PostMapping("/customer")
    public CustomerResponse createCustomer(@PathVariable String tenantId,
                                           @Valid @RequestBody CustomerRegistration registration) {
        String customerId = subscriptionService.createCustomerForTenant(BillableTenant.builder()
                .id(tenantId)
                .name(registration.name())
                .email(registration.email())
                .cpfCnpj(registration.cpfCnpj())
                .phone(registration.phone())
                .postalCode(registration.postalCode())
                .addressNumber(registration.addressNumber())
                .build());
        return new CustomerResponse(tenantId, customerId);
    }

    @PostMapping("/subscription")
    @ResponseStatus(HttpStatus.CREATED)
    public InitializeSubscriptionResult initializeSubscription(@PathVariable String tenantId,
                                                               @Valid @RequestBody SubscriptionRequest request) {
        return subscriptionService.initializeSubscription(new InitializeSubscriptionCommand(
                tenantId,
                request.planId(),
                Boolean.TRUE.equals(request.startWithTrial()),
                request.billingType()
        ));
    }

    @DeleteMapping("/subscription")
    public AccessContext cancelSubscription(@PathVariable String tenantId) {
        return BillingAccessProjection.project(subscriptionService.cancelSubscription(tenantId));
    }

    @PostMapping("/sync")
    public AccessContext sync(@PathVariable String tenantId) {
        return BillingAccessProjection.project(subscriptionService.sync(tenantId));
    }

    public record CustomerRegistration(
            @NotBlank String name,
            @Email String email,
            @NotBlank String cpfCnpj,
            String phone,
            String postalCode,
            String addressNumber
    ) {
    }

    public record CustomerResponse(String tenantId, String customerId) {
    }

    public record SubscriptionRequest(
            @NotBlank String planId,
            Boolean startWithTrial,
            String billingType
    ) {
    }
}
