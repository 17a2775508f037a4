package com.reliefpool.ledger.audit;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.UUID;

/**
 * Emitted when funds move from one center to another
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder(toBuilder = true)
public class FundsTransferredRecord extends AuditRecord {

    private final UUID fromCenterId;
    private final UUID toCenterId;
    private final String initiator;

    @Override
    public FundsTransferredRecord withSequence(int sequence) {
        return toBuilder().sequence(sequence).build();
    }

    @Override
    public AuditRecordType getRecordType() {
        return AuditRecordType.FUNDS_TRANSFERRED;
    }

    @Override
    public UUID getPrimaryCenterId() {
        return fromCenterId;
    }
}
