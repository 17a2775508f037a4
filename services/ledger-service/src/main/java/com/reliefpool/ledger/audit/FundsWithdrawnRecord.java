package com.reliefpool.ledger.audit;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.UUID;

/**
 * Emitted when funds leave the ledger to an external recipient
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder(toBuilder = true)
public class FundsWithdrawnRecord extends AuditRecord {

    private final UUID centerId;
    private final String recipient;
    private final String initiator;

    @Override
    public FundsWithdrawnRecord withSequence(int sequence) {
        return toBuilder().sequence(sequence).build();
    }

    @Override
    public AuditRecordType getRecordType() {
        return AuditRecordType.FUNDS_WITHDRAWN;
    }

    @Override
    public UUID getPrimaryCenterId() {
        return centerId;
    }
}
