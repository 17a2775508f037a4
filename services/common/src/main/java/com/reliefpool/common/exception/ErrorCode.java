package com.reliefpool.common.exception;

/**
 * Error codes for the ReliefPool platform
 * Format: MODULE_CATEGORY_SPECIFIC_ERROR
 */
public enum ErrorCode {

    // ===== LEDGER BUSINESS RULES (LEDGER_XXX) =====
    LEDGER_INVALID_AMOUNT("LEDGER_001", "Amount must be positive and within ledger range"),
    LEDGER_INSUFFICIENT_FUNDS("LEDGER_002", "Requested amount exceeds center balance"),
    LEDGER_UNAUTHORIZED_ACCESS("LEDGER_003", "Capability does not authorize this center"),
    LEDGER_SELF_TRANSFER("LEDGER_004", "Source and destination center are the same"),
    LEDGER_CENTER_NOT_FOUND("LEDGER_005", "Center not found"),

    // ===== LEDGER INFRASTRUCTURE (LEDGER_1XX) =====
    LEDGER_CONCURRENCY_CONFLICT("LEDGER_101", "Center is locked by another operation"),
    LEDGER_AUDIT_PUBLISH_FAILED("LEDGER_102", "Audit record could not be published"),

    // ===== GENERIC =====
    BUSINESS_ERROR("GEN_001", "Business rule violation");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    /**
     * Business rejections are caller mistakes and must not be retried as-is.
     * Infrastructure codes may succeed on a later attempt.
     */
    public boolean isRetryable() {
        return this == LEDGER_CONCURRENCY_CONFLICT;
    }
}
