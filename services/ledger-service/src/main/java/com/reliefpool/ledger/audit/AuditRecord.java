package com.reliefpool.ledger.audit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.UUID;

/**
 * Base class for all ledger audit records.
 * <p>
 * Records are write-once: every field is final and there are no setters. {@code sequence}
 * is the record's position among the records of the operation that produced it.
 */
@Getter
@ToString
@EqualsAndHashCode
@SuperBuilder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class AuditRecord {

    @Builder.Default
    private final UUID recordId = UUID.randomUUID();

    private final long epoch;

    private final int sequence;

    private final long amount;

    public abstract AuditRecordType getRecordType();

    /**
     * Copy of this record stamped with {@code sequence}.
     */
    public abstract AuditRecord withSequence(int sequence);

    /**
     * Center the record is filed under; used as the partition key of the audit stream.
     */
    @JsonIgnore
    public abstract UUID getPrimaryCenterId();
}
