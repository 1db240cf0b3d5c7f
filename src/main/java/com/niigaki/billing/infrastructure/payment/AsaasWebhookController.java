package com.niigaki.billing.infrastructure.payment;

import com.niigaki.billing.domain.exception.WebhookAuthenticationException;
import com.niigaki.billing.domain.exception.WebhookInvalidException;
import com.niigaki.billing.domain.model.ProcessingResult;
import com.niigaki.billing.domain.service.WebhookIngestionService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Asaas delivery endpoint. Anything that reached the ledger is acknowledged with 200; the
 * ledger owns retries from there.
 */
@RestController
@RequestMapping("/webhooks/asaas")
@RequiredArgsConstructor
public class AsaasWebhookController {

    static final String ACCESS_TOKEN_HEADER = "asaas-access-token";

    private static final Logger log = LoggerFactory.getLogger(AsaasWebhookController.class);

    private final WebhookIngestionService webhookIngestionService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<WebhookResponse> receive(@RequestHeader(value = ACCESS_TOKEN_HEADER, required = false) String accessToken,
                                                   @RequestBody(required = false) String body) {
        try {
            ProcessingResult result = webhookIngestionService.receive(accessToken, body);
            return ResponseEntity.ok(WebhookResponse.from(result));
        } catch (WebhookAuthenticationException e) {
            log.warn("Rejecting Asaas webhook due to invalid access token");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(new WebhookResponse(false, null, e.getMessage()));
        } catch (WebhookInvalidException e) {
            log.warn("Discarding malformed Asaas webhook reason={}", e.getMessage());
            return ResponseEntity.ok(new WebhookResponse(false, null, e.getMessage()));
        } catch (RuntimeException e) {
            // not recorded, so let the processor redeliver
            log.error("Failed to record Asaas webhook: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new WebhookResponse(false, null, "Webhook could not be recorded"));
        }
    }

    public record WebhookResponse(boolean success, String action, String error) {

        static WebhookResponse from(ProcessingResult result) {
            return new WebhookResponse(result.success(), result.action(), result.error());
        }
    }
}
