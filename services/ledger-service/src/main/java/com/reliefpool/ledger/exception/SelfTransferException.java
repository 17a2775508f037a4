package com.reliefpool.ledger.exception;

import com.reliefpool.common.exception.BusinessException;
import com.reliefpool.common.exception.ErrorCode;
import lombok.Getter;

import java.util.UUID;

@Getter
public class SelfTransferException extends BusinessException {

    private final UUID centerId;

    public SelfTransferException(UUID centerId) {
        super(ErrorCode.LEDGER_SELF_TRANSFER, "Cannot transfer from center " + centerId + " to itself");
        this.centerId = centerId;
        withMetadata("centerId", centerId);
    }
}
