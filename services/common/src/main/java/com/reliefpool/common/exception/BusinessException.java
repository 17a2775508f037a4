package com.reliefpool.common.exception;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base exception for all business-rule rejections in ReliefPool services.
 *
 * FEATURES:
 * - Typed error code via {@link ErrorCode}
 * - Unique error id for correlating a rejection across logs and audit streams
 * - Metadata map for runtime context (center ids, amounts)
 *
 * USAGE PATTERNS:
 * 1. Simple construction: new BusinessException(ErrorCode.XXX, "message")
 * 2. With cause: new BusinessException(ErrorCode.XXX, "message", cause)
 * 3. With metadata: new BusinessException(ErrorCode.XXX, "message").withMetadata("key", value)
 */
@Getter
public class BusinessException extends RuntimeException {

    private final String errorId;
    private final ErrorCode errorCode;
    private final Map<String, Object> metadata;
    private final Instant timestamp;

    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, null);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> metadata) {
        this(errorCode, message, null, metadata);
    }

    /**
     * Most complete constructor; all others delegate here.
     */
    public BusinessException(ErrorCode errorCode, String message, Throwable cause, Map<String, Object> metadata) {
        super(buildMessage(errorCode, message), cause);
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = errorCode != null ? errorCode : ErrorCode.BUSINESS_ERROR;
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        this.timestamp = Instant.now();
    }

    // ===== FLUENT API FOR METADATA ENRICHMENT =====

    /**
     * Add single metadata entry. Null keys and values are ignored.
     */
    public BusinessException withMetadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, value);
        }
        return this;
    }

    public BusinessException withMetadata(Map<String, Object> additionalMetadata) {
        if (additionalMetadata != null) {
            additionalMetadata.forEach(this::withMetadata);
        }
        return this;
    }

    /**
     * Read-only view; use withMetadata() to enrich.
     */
    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public String getCode() {
        return errorCode.getCode();
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }

    private static String buildMessage(ErrorCode errorCode, String message) {
        if (message != null && !message.isBlank()) {
            return message;
        }
        return errorCode != null ? errorCode.getDefaultMessage() : ErrorCode.BUSINESS_ERROR.getDefaultMessage();
    }
}
