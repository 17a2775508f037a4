package com.reliefpool.ledger.audit;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.UUID;

/**
 * Emitted when a donation is added to a center's balance
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder(toBuilder = true)
public class DonationReceivedRecord extends AuditRecord {

    private final UUID centerId;
    private final String donor;

    @Override
    public DonationReceivedRecord withSequence(int sequence) {
        return toBuilder().sequence(sequence).build();
    }

    @Override
    public AuditRecordType getRecordType() {
        return AuditRecordType.DONATION_RECEIVED;
    }

    @Override
    public UUID getPrimaryCenterId() {
        return centerId;
    }
}
