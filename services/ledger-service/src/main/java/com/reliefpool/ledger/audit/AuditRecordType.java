package com.reliefpool.ledger.audit;

public enum AuditRecordType {
    DONATION_RECEIVED,
    TOKENS_MINTED,
    FUNDS_TRANSFERRED,
    FUNDS_WITHDRAWN
}
