package com.reliefpool.ledger.exception;

import com.reliefpool.common.exception.BusinessException;
import com.reliefpool.common.exception.ErrorCode;

import java.util.UUID;

/**
 * Audit record could not be handed to the external stream.
 * Ledger state the record describes is already committed.
 */
public class AuditPublishException extends BusinessException {

    public AuditPublishException(UUID recordId, String recordType, Throwable cause) {
        super(ErrorCode.LEDGER_AUDIT_PUBLISH_FAILED,
                "Failed to publish audit record " + recordType + " " + recordId + ": " + cause.getMessage(), cause);
        withMetadata("recordId", recordId).withMetadata("recordType", recordType);
    }
}
