package com.niigaki.billing.infrastructure.payment;

import com.niigaki.billing.domain.exception.WebhookAuthenticationException;
import com.niigaki.billing.domain.exception.WebhookInvalidException;
import com.niigaki.billing.domain.model.ProcessingResult;
import com.niigaki.billing.domain.service.WebhookIngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AsaasWebhookControllerTest {

    private static final String BODY = "{\"id\":\"evt_1\",\"event\":\"PAYMENT_CONFIRMED\"}";

    @Mock
    private WebhookIngestionService webhookIngestionService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AsaasWebhookController(webhookIngestionService)).build();
    }

    @Test
    void receive_returnsProcessingOutcome() throws Exception {
        when(webhookIngestionService.receive("token", BODY))
                .thenReturn(ProcessingResult.success("PAYMENT_CONFIRMED", "tenant-1", "tenant_activated"));

        mockMvc.perform(post("/webhooks/asaas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("asaas-access-token", "token")
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.action").value("tenant_activated"));
    }

    @Test
    void receive_failedProcessingIsStillAcknowledged() throws Exception {
        when(webhookIngestionService.receive("token", BODY))
                .thenReturn(ProcessingResult.failure("PAYMENT_CONFIRMED", "tenant-1", "Invalid billing status transition", true));

        mockMvc.perform(post("/webhooks/asaas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("asaas-access-token", "token")
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Invalid billing status transition"));
    }

    @Test
    void receive_invalidTokenIsUnauthorized() throws Exception {
        when(webhookIngestionService.receive(eq("bad"), anyString()))
                .thenThrow(new WebhookAuthenticationException("Invalid webhook access token"));

        mockMvc.perform(post("/webhooks/asaas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("asaas-access-token", "bad")
                        .content(BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void receive_malformedBodyIsAcknowledgedAsFailure() throws Exception {
        when(webhookIngestionService.receive("token", "{oops"))
                .thenThrow(new WebhookInvalidException("Unreadable webhook body"));

        mockMvc.perform(post("/webhooks/asaas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("asaas-access-token", "token")
                        .content("{oops"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void receive_ledgerOutageAsksForRedelivery() throws Exception {
        when(webhookIngestionService.receive("token", BODY))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        mockMvc.perform(post("/webhooks/asaas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("asaas-access-token", "token")
                        .content(BODY))
                .andExpect(status().isInternalServerError());
    }
}
