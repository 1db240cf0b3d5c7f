package com.niigaki.billing.application.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.niigaki.billing.domain.exception.AsaasApiException;
import com.niigaki.billing.domain.model.BillingCycle;
import com.niigaki.billing.domain.service.BillingGateway;
import com.niigaki.billing.infrastructure.config.AsaasProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link BillingGateway} over the Asaas v3 REST API.
 */
@Service
@Slf4j
public class AsaasBillingGateway implements BillingGateway {

    private static final ParameterizedTypeReference<AsaasPage<AsaasCustomer>> CUSTOMER_PAGE =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient asaasRestClient;
    private final AsaasProperties asaasProperties;

    public AsaasBillingGateway(RestClient asaasRestClient, AsaasProperties asaasProperties) {
        this.asaasRestClient = asaasRestClient;
        this.asaasProperties = asaasProperties;
    }

    @Override
    public String gatewayCode() {
        return "ASAAS";
    }

    @Override
    public CustomerData createCustomer(CustomerRequest request) {
        AsaasCustomer created = call("createCustomer", () -> asaasRestClient.post()
                .uri("/customers")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new AsaasCustomerCreate(
                        request.name(),
                        request.email(),
                        request.cpfCnpj(),
                        request.phone(),
                        request.postalCode(),
                        request.addressNumber(),
                        request.externalReference()))
                .retrieve()
                .body(AsaasCustomer.class));
        log.info("Asaas customer created customerId={} externalReference={}", created.id(), created.externalReference());
        return toCustomerData(created);
    }

    @Override
    public Optional<CustomerData> findCustomerByExternalReference(String externalReference) {
        if (externalReference == null || externalReference.isBlank()) {
            return Optional.empty();
        }
        AsaasPage<AsaasCustomer> page = call("findCustomerByExternalReference", () -> asaasRestClient.get()
                .uri(uri -> uri.path("/customers").queryParam("externalReference", externalReference).build())
                .retrieve()
                .body(CUSTOMER_PAGE));
        if (page == null || page.data() == null || page.data().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toCustomerData(page.data().get(0)));
    }

    @Override
    public SubscriptionData createSubscription(SubscriptionRequest request) {
        AsaasSubscription created = call("createSubscription", () -> asaasRestClient.post()
                .uri("/subscriptions")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new AsaasSubscriptionCreate(
                        request.customerId(),
                        request.billingType(),
                        request.value(),
                        request.nextDueDate() == null ? null : request.nextDueDate().toString(),
                        request.cycle() == null ? BillingCycle.MONTHLY.name() : request.cycle().name(),
                        request.description(),
                        request.externalReference()))
                .retrieve()
                .body(AsaasSubscription.class));
        log.info("Asaas subscription created subscriptionId={} customerId={}", created.id(), created.customer());
        return toSubscriptionData(created);
    }

    @Override
    public SubscriptionData getSubscription(String subscriptionId) {
        AsaasSubscription subscription = call("getSubscription", () -> asaasRestClient.get()
                .uri("/subscriptions/{id}", subscriptionId)
                .retrieve()
                .body(AsaasSubscription.class));
        return toSubscriptionData(subscription);
    }

    @Override
    public CancellationData cancelSubscription(String subscriptionId) {
        AsaasDeletion deletion = call("cancelSubscription", () -> asaasRestClient.delete()
                .uri("/subscriptions/{id}", subscriptionId)
                .retrieve()
                .body(AsaasDeletion.class));
        log.info("Asaas subscription removed subscriptionId={} deleted={}", subscriptionId, deletion.deleted());
        return new CancellationData(firstNonBlank(deletion.id(), subscriptionId), Boolean.TRUE.equals(deletion.deleted()));
    }

    private <T> T call(String operation, Supplier<T> request) {
        validateConfigured();
        T body;
        try {
            body = request.get();
        } catch (RestClientResponseException e) {
            List<AsaasApiException.ApiErrorDetail> errors = readErrors(e);
            String message = errors.isEmpty()
                    ? "Asaas " + operation + " failed with status " + e.getStatusCode().value()
                    : errors.get(0).description();
            log.warn("Asaas call failed operation={} status={} message={}", operation, e.getStatusCode().value(), message);
            throw new AsaasApiException(e.getStatusCode().value(), message, errors, e);
        } catch (RestClientException e) {
            log.warn("Asaas call failed operation={} reason={}", operation, e.getMessage());
            throw new AsaasApiException(0, "Asaas " + operation + " failed: " + e.getMessage(), List.of(), e);
        }
        if (body == null) {
            throw new AsaasApiException(0, "Asaas " + operation + " returned an empty body", List.of(), null);
        }
        return body;
    }

    private List<AsaasApiException.ApiErrorDetail> readErrors(RestClientResponseException e) {
        try {
            AsaasErrorResponse response = e.getResponseBodyAs(AsaasErrorResponse.class);
            if (response == null || response.errors() == null) {
                return List.of();
            }
            return response.errors().stream()
                    .map(error -> new AsaasApiException.ApiErrorDetail(error.code(), error.description()))
                    .toList();
        } catch (RestClientException | IllegalStateException parseFailure) {
            log.debug("Asaas error body not readable status={} reason={}", e.getStatusCode().value(), parseFailure.getMessage());
            return List.of();
        }
    }

    private void validateConfigured() {
        if (asaasProperties.getApiKey() == null || asaasProperties.getApiKey().isBlank()) {
            throw new AsaasApiException(0, "Asaas api key is not configured", List.of(), null);
        }
    }

    private CustomerData toCustomerData(AsaasCustomer customer) {
        return new CustomerData(customer.id(), customer.name(), customer.email(), customer.externalReference());
    }

    private SubscriptionData toSubscriptionData(AsaasSubscription subscription) {
        return new SubscriptionData(
                subscription.id(),
                subscription.customer(),
                subscription.status(),
                Boolean.TRUE.equals(subscription.deleted()),
                parseDate(subscription.nextDueDate()),
                subscription.value(),
                subscription.externalReference()
        );
    }

    private LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable Asaas date value={}", value);
            return null;
        }
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record AsaasCustomerCreate(
            String name,
            String email,
            String cpfCnpj,
            String mobilePhone,
            String postalCode,
            String addressNumber,
            String externalReference
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record AsaasSubscriptionCreate(
            String customer,
            String billingType,
            BigDecimal value,
            String nextDueDate,
            String cycle,
            String description,
            String externalReference
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AsaasCustomer(String id, String name, String email, String externalReference) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AsaasSubscription(
            String id,
            String customer,
            String status,
            Boolean deleted,
            String nextDueDate,
            BigDecimal value,
            String externalReference
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AsaasDeletion(String id, Boolean deleted) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AsaasPage<T>(List<T> data, Boolean hasMore, Integer totalCount) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AsaasErrorResponse(List<AsaasError> errors) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AsaasError(String code, String description) {
    }
}
