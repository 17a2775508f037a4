package com.reliefpool.ledger.audit;

/**
 * Sink for committed audit records. Called once per record, in the order the
 * producing operation staged them.
 */
public interface AuditEventEmitter {

    void emit(AuditRecord record);
}
