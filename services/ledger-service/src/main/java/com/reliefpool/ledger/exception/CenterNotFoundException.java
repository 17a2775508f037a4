package com.reliefpool.ledger.exception;

import com.reliefpool.common.exception.BusinessException;
import com.reliefpool.common.exception.ErrorCode;
import lombok.Getter;

import java.util.UUID;

@Getter
public class CenterNotFoundException extends BusinessException {

    private final UUID centerId;

    public CenterNotFoundException(UUID centerId) {
        super(ErrorCode.LEDGER_CENTER_NOT_FOUND, "Center not found: " + centerId);
        this.centerId = centerId;
        withMetadata("centerId", centerId);
    }
}
