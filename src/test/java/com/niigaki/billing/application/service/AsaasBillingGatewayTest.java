package com.niigaki.billing.application.service;

import com.niigaki.billing.domain.exception.AsaasApiException;
import com.niigaki.billing.domain.model.BillingCycle;
import com.niigaki.billing.domain.service.BillingGateway;
import com.niigaki.billing.infrastructure.config.AsaasProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class AsaasBillingGatewayTest {

    private static final String BASE_URL = "https://sandbox.asaas.com/api/v3";

    private MockRestServiceServer server;
    private AsaasProperties asaasProperties;
    private AsaasBillingGateway gateway;

    @BeforeEach
    void setUp() {
        asaasProperties = new AsaasProperties();
        asaasProperties.setApiKey("key_123");
        RestClient.Builder builder = RestClient.builder()
                .baseUrl(BASE_URL)
                .defaultHeader("access_token", "key_123");
        server = MockRestServiceServer.bindTo(builder).build();
        gateway = new AsaasBillingGateway(builder.build(), asaasProperties);
    }

    @Test
    void getSubscription_mapsRemoteView() {
        server.expect(requestTo(BASE_URL + "/subscriptions/sub_1"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("access_token", "key_123"))
                .andRespond(withSuccess("""
                        {"object":"subscription","id":"sub_1","customer":"cus_1","status":"ACTIVE",
                         "deleted":false,"nextDueDate":"2024-05-10","value":99.90,"externalReference":"tenant-1"}
                        """, MediaType.APPLICATION_JSON));

        BillingGateway.SubscriptionData subscription = gateway.getSubscription("sub_1");

        assertThat(subscription.id()).isEqualTo("sub_1");
        assertThat(subscription.status()).isEqualTo("ACTIVE");
        assertThat(subscription.deleted()).isFalse();
        assertThat(subscription.nextDueDate()).isEqualTo(LocalDate.of(2024, 5, 10));
        assertThat(subscription.value()).isEqualByComparingTo("99.90");
        server.verify();
    }

    @Test
    void createSubscription_sendsPlanTerms() {
        server.expect(requestTo(BASE_URL + "/subscriptions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.customer").value("cus_1"))
                .andExpect(jsonPath("$.billingType").value("PIX"))
                .andExpect(jsonPath("$.value").value(49.9))
                .andExpect(jsonPath("$.nextDueDate").value("2024-04-15"))
                .andExpect(jsonPath("$.cycle").value("MONTHLY"))
                .andExpect(jsonPath("$.externalReference").value("tenant-1"))
                .andRespond(withSuccess("{\"id\":\"sub_new\",\"customer\":\"cus_1\",\"status\":\"ACTIVE\"}",
                        MediaType.APPLICATION_JSON));

        BillingGateway.SubscriptionData created = gateway.createSubscription(new BillingGateway.SubscriptionRequest(
                "cus_1", "PIX", new BigDecimal("49.90"), LocalDate.of(2024, 4, 15), BillingCycle.MONTHLY,
                "Subscription: Starter", "tenant-1"));

        assertThat(created.id()).isEqualTo("sub_new");
        server.verify();
    }

    @Test
    void findCustomerByExternalReference_returnsFirstMatch() {
        server.expect(requestTo(BASE_URL + "/customers?externalReference=tenant-1"))
                .andRespond(withSuccess("""
                        {"object":"list","hasMore":false,"totalCount":1,
                         "data":[{"id":"cus_1","name":"Acme","email":"billing@acme.test","externalReference":"tenant-1"}]}
                        """, MediaType.APPLICATION_JSON));

        assertThat(gateway.findCustomerByExternalReference("tenant-1"))
                .hasValueSatisfying(customer -> assertThat(customer.id()).isEqualTo("cus_1"));
    }

    @Test
    void findCustomerByExternalReference_emptyPage() {
        server.expect(requestTo(BASE_URL + "/customers?externalReference=tenant-2"))
                .andRespond(withSuccess("{\"data\":[]}", MediaType.APPLICATION_JSON));

        assertThat(gateway.findCustomerByExternalReference("tenant-2")).isEmpty();
    }

    @Test
    void createCustomer_postsCustomerData() {
        server.expect(requestTo(BASE_URL + "/customers"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.cpfCnpj").value("12345678000199"))
                .andExpect(jsonPath("$.externalReference").value("tenant-1"))
                .andExpect(content().string(not(containsString("mobilePhone"))))
                .andRespond(withSuccess("{\"id\":\"cus_9\",\"name\":\"Acme\",\"externalReference\":\"tenant-1\"}",
                        MediaType.APPLICATION_JSON));

        BillingGateway.CustomerData customer = gateway.createCustomer(new BillingGateway.CustomerRequest(
                "Acme", "billing@acme.test", "12345678000199", null, null, null, "tenant-1"));

        assertThat(customer.id()).isEqualTo("cus_9");
    }

    @Test
    void cancelSubscription_readsDeletionFlag() {
        server.expect(requestTo(BASE_URL + "/subscriptions/sub_1"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess("{\"deleted\":true,\"id\":\"sub_1\"}", MediaType.APPLICATION_JSON));

        BillingGateway.CancellationData cancellation = gateway.cancelSubscription("sub_1");

        assertThat(cancellation.deleted()).isTrue();
        assertThat(cancellation.id()).isEqualTo("sub_1");
    }

    @Test
    void errorResponse_becomesAsaasApiExceptionWithDetails() {
        server.expect(requestTo(BASE_URL + "/subscriptions/sub_missing"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"errors\":[{\"code\":\"invalid_action\",\"description\":\"Subscription not found\"}]}"));

        assertThatThrownBy(() -> gateway.getSubscription("sub_missing"))
                .hasMessage("Subscription not found")
                .isInstanceOfSatisfying(AsaasApiException.class, ex -> {
                    assertThat(ex.isNotFound()).isTrue();
                    assertThat(ex.getErrors()).extracting(AsaasApiException.ApiErrorDetail::code)
                            .containsExactly("invalid_action");
                    assertThat(ex.isRetryable()).isTrue();
                });
    }

    @Test
    void serverErrorWithoutBody_stillCarriesStatus() {
        server.expect(requestTo(BASE_URL + "/subscriptions/sub_1"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> gateway.getSubscription("sub_1"))
                .isInstanceOfSatisfying(AsaasApiException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(502));
    }

    @Test
    void missingApiKey_failsBeforeCallingOut() {
        asaasProperties.setApiKey(" ");

        assertThatThrownBy(() -> gateway.getSubscription("sub_1"))
                .isInstanceOf(AsaasApiException.class)
                .hasMessageContaining("not configured");
        server.verify();
    }
}
