package com.niigaki.billing.domain.exception;

import lombok.Getter;

import java.util.List;

/**
 * A call to the Asaas API failed. Always worth retrying from the ledger's point of view.
 */
@Getter
public class AsaasApiException extends BillingException {

    private final int statusCode;
    private final List<ApiErrorDetail> errors;

    public AsaasApiException(int statusCode, String message, List<ApiErrorDetail> errors, Throwable cause) {
        super(BillingErrorCode.ASAAS_API_ERROR, message, cause);
        this.statusCode = statusCode;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public record ApiErrorDetail(String code, String description) {
    }
}
