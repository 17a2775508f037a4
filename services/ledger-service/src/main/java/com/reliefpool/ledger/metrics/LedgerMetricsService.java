package com.reliefpool.ledger.metrics;

import com.reliefpool.common.exception.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Ledger Metrics Service
 * Tracks ledger operations and rejections for monitoring
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerMetricsService {

    private final MeterRegistry meterRegistry;

    public void recordCenterCreated() {
        Counter.builder("ledger.centers.created")
                .description("Number of relief centers opened")
                .register(meterRegistry)
                .increment();
    }

    public void recordDonation(long amount) {
        Counter.builder("ledger.donations")
                .description("Number of donations accepted")
                .register(meterRegistry)
                .increment();
        Counter.builder("ledger.donations.amount")
                .description("Total donated amount in smallest currency units")
                .register(meterRegistry)
                .increment(amount);
    }

    public void recordTransfer(long amount) {
        Counter.builder("ledger.transfers")
                .description("Number of center-to-center transfers")
                .register(meterRegistry)
                .increment();
        Counter.builder("ledger.transfers.amount")
                .description("Total amount moved between centers")
                .register(meterRegistry)
                .increment(amount);
    }

    public void recordWithdrawal(long amount) {
        Counter.builder("ledger.withdrawals")
                .description("Number of withdrawals to external recipients")
                .register(meterRegistry)
                .increment();
        Counter.builder("ledger.withdrawals.amount")
                .description("Total amount withdrawn from the ledger")
                .register(meterRegistry)
                .increment(amount);
    }

    public void recordRejection(String operation, ErrorCode reason) {
        log.debug("Recording ledger rejection metric: operation={}, reason={}", operation, reason);

        Counter.builder("ledger.rejections")
                .tag("operation", operation)
                .tag("reason", reason.name())
                .description("Ledger operations rejected by business rules")
                .register(meterRegistry)
                .increment();
    }
}
