package com.reliefpool.ledger.exception;

import com.reliefpool.common.exception.BusinessException;
import com.reliefpool.common.exception.ErrorCode;
import lombok.Getter;

import java.util.UUID;

/**
 * Amount is zero or negative, or would overflow a ledger counter.
 * <p>
 * Transfers and withdrawals report a non-positive amount here and not as
 * {@link InsufficientFundsException}, even though {@code 0 < amount <= balance} reads as a
 * single funds precondition. Insufficient funds is only raised for a positive amount above
 * the balance.
 */
@Getter
public class InvalidAmountException extends BusinessException {

    private final UUID centerId;
    private final long amount;

    public InvalidAmountException(UUID centerId, long amount) {
        super(ErrorCode.LEDGER_INVALID_AMOUNT,
                String.format("Amount must be positive for center %s, got %d", centerId, amount));
        this.centerId = centerId;
        this.amount = amount;
        withMetadata("centerId", centerId).withMetadata("amount", amount);
    }

    public InvalidAmountException(UUID centerId, long amount, ArithmeticException overflow) {
        super(ErrorCode.LEDGER_INVALID_AMOUNT,
                String.format("Amount %d overflows ledger counters of center %s", amount, centerId), overflow);
        this.centerId = centerId;
        this.amount = amount;
        withMetadata("centerId", centerId).withMetadata("amount", amount);
    }
}
