package com.reliefpool.ledger.exception;

import com.reliefpool.common.exception.BusinessException;
import com.reliefpool.common.exception.ErrorCode;
import lombok.Getter;

import java.util.UUID;

/**
 * Exception thrown when a center holds less than the amount requested
 */
@Getter
public class InsufficientFundsException extends BusinessException {

    private final UUID centerId;
    private final long requestedAmount;
    private final long availableAmount;

    public InsufficientFundsException(UUID centerId, long requestedAmount, long availableAmount) {
        super(ErrorCode.LEDGER_INSUFFICIENT_FUNDS,
                String.format("Insufficient funds in center %s. Requested: %d, Available: %d",
                        centerId, requestedAmount, availableAmount));
        this.centerId = centerId;
        this.requestedAmount = requestedAmount;
        this.availableAmount = availableAmount;
        withMetadata("centerId", centerId)
                .withMetadata("requestedAmount", requestedAmount)
                .withMetadata("availableAmount", availableAmount);
    }
}
