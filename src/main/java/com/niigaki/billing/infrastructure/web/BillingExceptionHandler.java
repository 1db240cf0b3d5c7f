package com.niigaki.billing.infrastructure.web;

import com.niigaki.billing.domain.exception.AsaasApiException;
import com.niigaki.billing.domain.exception.BillingException;
import com.niigaki.billing.domain.exception.BillingStatusInvalidException;
import com.niigaki.billing.domain.exception.InvalidBillingTransitionException;
import com.niigaki.billing.domain.exception.TenantBillingNotFoundException;
import com.niigaki.billing.domain.model.BillingStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.NoSuchElementException;

@RestControllerAdvice
@Slf4j
public class BillingExceptionHandler {

    @ExceptionHandler(BillingStatusInvalidException.class)
    public ResponseEntity<ErrorBody> handleStatusInvalid(BillingStatusInvalidException ex) {
        BillingStatus current = ex.getCurrentStatus();
        HttpStatus status = current == BillingStatus.CANCELED ? HttpStatus.FORBIDDEN : HttpStatus.PAYMENT_REQUIRED;
        return ResponseEntity.status(status).body(new ErrorBody(
                OffsetDateTime.now(),
                ex.getCode().name(),
                ex.getMessage(),
                current,
                ex.getRequiredStatuses()
        ));
    }

    @ExceptionHandler(TenantBillingNotFoundException.class)
    public ResponseEntity<ErrorBody> handleNotFound(TenantBillingNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(InvalidBillingTransitionException.class)
    public ResponseEntity<ErrorBody> handleInvalidTransition(InvalidBillingTransitionException ex) {
        return error(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(AsaasApiException.class)
    public ResponseEntity<ErrorBody> handleAsaas(AsaasApiException ex) {
        log.warn("Asaas call failed status={} message={}", ex.getStatusCode(), ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler(BillingException.class)
    public ResponseEntity<ErrorBody> handleBilling(BillingException ex) {
        log.warn("Billing request failed code={} message={}", ex.getCode(), ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ErrorBody> handleMissing(NoSuchElementException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorBody(OffsetDateTime.now(), "NOT_FOUND", ex.getMessage(), null, List.of()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorBody(OffsetDateTime.now(), "BAD_REQUEST", ex.getMessage(), null, List.of()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorBody> handleIllegalState(IllegalStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorBody(OffsetDateTime.now(), "CONFLICT", ex.getMessage(), null, List.of()));
    }

    private ResponseEntity<ErrorBody> error(HttpStatus status, BillingException ex) {
        return ResponseEntity.status(status)
                .body(new ErrorBody(OffsetDateTime.now(), ex.getCode().name(), ex.getMessage(), null, List.of()));
    }

    public record ErrorBody(
            OffsetDateTime timestamp,
            String error,
            String message,
            BillingStatus currentStatus,
            List<BillingStatus> requiredStatuses
    ) {
    }
}
