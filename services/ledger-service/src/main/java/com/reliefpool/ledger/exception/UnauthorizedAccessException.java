package com.reliefpool.ledger.exception;

import com.reliefpool.common.exception.BusinessException;
import com.reliefpool.common.exception.ErrorCode;
import lombok.Getter;

import java.util.UUID;

/**
 * Presented capability is missing or bound to a different center.
 */
@Getter
public class UnauthorizedAccessException extends BusinessException {

    private final UUID targetCenterId;
    private final UUID capabilityCenterId;

    public UnauthorizedAccessException(UUID targetCenterId, UUID capabilityCenterId) {
        super(ErrorCode.LEDGER_UNAUTHORIZED_ACCESS,
                String.format("Capability bound to %s does not authorize center %s",
                        capabilityCenterId, targetCenterId));
        this.targetCenterId = targetCenterId;
        this.capabilityCenterId = capabilityCenterId;
        withMetadata("targetCenterId", targetCenterId)
                .withMetadata("capabilityCenterId", capabilityCenterId);
    }
}
