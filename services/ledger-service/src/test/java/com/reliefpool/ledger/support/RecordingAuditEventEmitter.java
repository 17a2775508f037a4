package com.reliefpool.ledger.support;

import com.reliefpool.ledger.audit.AuditEventEmitter;
import com.reliefpool.ledger.audit.AuditRecord;
import com.reliefpool.ledger.audit.AuditRecordType;
import com.reliefpool.ledger.exception.AuditPublishException;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Test sink that keeps every emitted record in emission order. It can be told to reject
 * records of given types, which are then not kept.
 */
public class RecordingAuditEventEmitter implements AuditEventEmitter {

    private final List<AuditRecord> records = new CopyOnWriteArrayList<>();
    private final Set<AuditRecordType> rejectedTypes = ConcurrentHashMap.newKeySet();

    @Override
    public void emit(AuditRecord record) {
        if (rejectedTypes.contains(record.getRecordType())) {
            throw new AuditPublishException(record.getRecordId(), record.getRecordType().name(),
                    new IllegalStateException("audit sink unavailable"));
        }
        records.add(record);
    }

    public void rejectType(AuditRecordType type) {
        rejectedTypes.add(type);
    }

    public List<AuditRecordType> recordTypes() {
        return records.stream()
                .map(AuditRecord::getRecordType)
                .collect(Collectors.toList());
    }

    public List<AuditRecord> records() {
        return List.copyOf(records);
    }

    public <R extends AuditRecord> List<R> recordsOfType(Class<R> type) {
        return records.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public void clear() {
        records.clear();
    }
}
