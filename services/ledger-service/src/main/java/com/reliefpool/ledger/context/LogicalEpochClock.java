package com.reliefpool.ledger.context;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic logical epoch used to timestamp audit records.
 * Hosts with their own sequencing advance it; it never moves backwards.
 */
@Slf4j
public class LogicalEpochClock {

    private final AtomicLong epoch;

    public LogicalEpochClock(long initialEpoch) {
        if (initialEpoch < 0) {
            throw new IllegalArgumentException("initial epoch must not be negative: " + initialEpoch);
        }
        this.epoch = new AtomicLong(initialEpoch);
    }

    public long current() {
        return epoch.get();
    }

    public long advance() {
        long next = epoch.incrementAndGet();
        log.debug("Logical epoch advanced to {}", next);
        return next;
    }
}
