package com.niigaki.billing.infrastructure.web;

import com.niigaki.billing.domain.model.WebhookEvent;
import com.niigaki.billing.domain.model.WebhookEventStatus;
import com.niigaki.billing.domain.service.WebhookIngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.NoSuchElementException;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class WebhookLedgerControllerTest {

    @Mock
    private WebhookIngestionService webhookIngestionService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new WebhookLedgerController(webhookIngestionService))
                .setControllerAdvice(new BillingExceptionHandler())
                .build();
    }

    @Test
    void reset_returnsPendingEntry() throws Exception {
        WebhookEvent event = new WebhookEvent();
        event.setId("evt-1");
        event.setEventType("PAYMENT_CONFIRMED");
        event.setStatus(WebhookEventStatus.PENDING);
        event.setAttempts(0);
        event.setMaxAttempts(3);
        when(webhookIngestionService.resetFailed("evt-1")).thenReturn(event);

        mockMvc.perform(post("/api/webhook-events/evt-1/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.attempts").value(0))
                .andExpect(jsonPath("$.maxAttempts").value(3));
    }

    @Test
    void reset_unknownEntryIsNotFound() throws Exception {
        when(webhookIngestionService.resetFailed("missing"))
                .thenThrow(new NoSuchElementException("Webhook event not found: missing"));

        mockMvc.perform(post("/api/webhook-events/missing/reset"))
                .andExpect(status().isNotFound());
    }

    @Test
    void reset_entryNotFailedIsConflict() throws Exception {
        when(webhookIngestionService.resetFailed("evt-2"))
                .thenThrow(new IllegalStateException("Only failed webhook events can be reset"));

        mockMvc.perform(post("/api/webhook-events/evt-2/reset"))
                .andExpect(status().isConflict());
    }
}
