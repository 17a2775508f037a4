package com.reliefpool.ledger.exception;

import com.reliefpool.common.exception.BusinessException;
import com.reliefpool.common.exception.ErrorCode;
import lombok.Getter;

import java.time.Duration;
import java.util.UUID;

/**
 * Exception thrown when a center could not be locked for exclusive mutation in time
 */
@Getter
public class LedgerConcurrencyException extends BusinessException {

    private final UUID centerId;

    public LedgerConcurrencyException(UUID centerId, Duration waited) {
        super(ErrorCode.LEDGER_CONCURRENCY_CONFLICT,
                String.format("Center %s still locked after %d ms", centerId, waited.toMillis()));
        this.centerId = centerId;
        withMetadata("centerId", centerId);
    }

    public LedgerConcurrencyException(UUID centerId, InterruptedException cause) {
        super(ErrorCode.LEDGER_CONCURRENCY_CONFLICT,
                "Interrupted while waiting for lock on center " + centerId, cause);
        this.centerId = centerId;
        withMetadata("centerId", centerId);
    }
}
