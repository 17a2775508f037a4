package com.reliefpool.ledger.audit;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.UUID;

/**
 * Emitted when a contribution credit is issued to a donor
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder(toBuilder = true)
public class TokensMintedRecord extends AuditRecord {

    private final UUID centerId;
    private final UUID creditId;
    private final String recipient;

    @Override
    public TokensMintedRecord withSequence(int sequence) {
        return toBuilder().sequence(sequence).build();
    }

    @Override
    public AuditRecordType getRecordType() {
        return AuditRecordType.TOKENS_MINTED;
    }

    @Override
    public UUID getPrimaryCenterId() {
        return centerId;
    }
}
