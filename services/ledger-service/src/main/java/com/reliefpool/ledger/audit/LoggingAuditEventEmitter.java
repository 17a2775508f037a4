package com.reliefpool.ledger.audit;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes each audit record as one structured log line. Default sink, and the fallback
 * when the Kafka stream rejects a record.
 */
@Slf4j
public class LoggingAuditEventEmitter implements AuditEventEmitter {

    @Override
    public void emit(AuditRecord record) {
        log.info("AUDIT_RECORD: type={}, recordId={}, centerId={}, epoch={}, sequence={}, amount={}, detail={}",
                record.getRecordType(),
                record.getRecordId(),
                record.getPrimaryCenterId(),
                record.getEpoch(),
                record.getSequence(),
                record.getAmount(),
                record);
    }
}
