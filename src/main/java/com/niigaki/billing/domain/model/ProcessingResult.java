package com.niigaki.billing.domain.model;

/**
 * Outcome of dispatching one webhook event.
 *
 * @param retryable only meaningful when {@code success} is false; tells the ledger whether a
 *                  later attempt may succeed
 */
public record ProcessingResult(
        boolean success,
        String eventType,
        String tenantId,
        String action,
        String error,
        boolean retryable
) {

    public static final String ACTION_IGNORED = "ignored";
    public static final String ACTION_TENANT_NOT_FOUND = "tenant_not_found";
    public static final String ACTION_ALREADY_PROCESSING = "already_processing";

    public static ProcessingResult success(String eventType, String tenantId, String action) {
        return new ProcessingResult(true, eventType, tenantId, action, null, false);
    }

    public static ProcessingResult ignored(String eventType) {
        return success(eventType, null, ACTION_IGNORED);
    }

    public static ProcessingResult tenantNotFound(String eventType) {
        return success(eventType, null, ACTION_TENANT_NOT_FOUND);
    }

    public static ProcessingResult failure(String eventType, String tenantId, String error, boolean retryable) {
        return new ProcessingResult(false, eventType, tenantId, null, error, retryable);
    }

    /**
     * Ignored outcomes are acknowledged without any effect on billing state.
     */
    public boolean isNoOp() {
        return success && action != null && action.endsWith(ACTION_IGNORED);
    }
}
