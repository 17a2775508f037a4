package com.reliefpool.ledger.context;

import java.util.Objects;

/**
 * Per-call values supplied by the host: who invoked the operation and at which logical epoch.
 * The principal is recorded in audit records and as credit owner. It never authorizes anything.
 */
public record OperationContext(String principal, long epoch) {

    public OperationContext {
        Objects.requireNonNull(principal, "principal");
        if (epoch < 0) {
            throw new IllegalArgumentException("epoch must not be negative: " + epoch);
        }
    }

    public static OperationContext of(String principal, LogicalEpochClock clock) {
        return new OperationContext(principal, clock.current());
    }
}
