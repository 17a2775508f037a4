package com.reliefpool.ledger.service;

import com.reliefpool.common.exception.BusinessException;
import com.reliefpool.ledger.audit.DonationReceivedRecord;
import com.reliefpool.ledger.audit.TokensMintedRecord;
import com.reliefpool.ledger.context.OperationContext;
import com.reliefpool.ledger.domain.Center;
import com.reliefpool.ledger.domain.ContributionCredit;
import com.reliefpool.ledger.exception.InvalidAmountException;
import com.reliefpool.ledger.metrics.LedgerMetricsService;
import com.reliefpool.ledger.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Accepts donations and issues contribution credits.
 *
 * Credits are issued 1:1 with the donated amount. Donating needs no capability.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContributionService {

    private static final String OPERATION = "donate";

    private final LedgerStore ledgerStore;
    private final LedgerMetricsService metricsService;

    /**
     * Adds {@code amount} to the center's balance and contribution total, and issues the
     * donor a credit of the same quantity. Emits DonationReceived then TokensMinted.
     *
     * @throws InvalidAmountException if amount is not positive or would overflow a counter
     */
    public ContributionCredit donate(UUID centerId, long amount, OperationContext context) {
        Objects.requireNonNull(centerId, "centerId");
        Objects.requireNonNull(context, "context");

        try {
            if (amount <= 0) {
                throw new InvalidAmountException(centerId, amount);
            }

            ContributionCredit credit = ledgerStore.execute(List.of(centerId),
                    unit -> {
                        Center center = unit.center(centerId);
                        requireNoOverflow(center, amount);

                        center.credit(amount);
                        center.recordContribution(amount);

                        ContributionCredit issued = ContributionCredit.builder()
                                .id(UUID.randomUUID())
                                .centerId(centerId)
                                .owner(context.principal())
                                .quantity(amount)
                                .issuedEpoch(context.epoch())
                                .build();
                        center.recordIssuance(issued.getQuantity());
                        unit.issue(issued);

                        unit.stage(DonationReceivedRecord.builder()
                                .centerId(centerId)
                                .donor(context.principal())
                                .amount(amount)
                                .epoch(context.epoch())
                                .build());
                        unit.stage(TokensMintedRecord.builder()
                                .centerId(centerId)
                                .creditId(issued.getId())
                                .recipient(context.principal())
                                .amount(issued.getQuantity())
                                .epoch(context.epoch())
                                .build());
                        return issued;
                    });

            metricsService.recordDonation(amount);
            log.info("Donation accepted: center={}, donor={}, amount={}, credit={}, epoch={}",
                    centerId, context.principal(), amount, credit.getId(), context.epoch());
            return credit;

        } catch (BusinessException e) {
            metricsService.recordRejection(OPERATION, e.getErrorCode());
            log.warn("Donation rejected: center={}, donor={}, amount={}, code={}, retryable={}, reason={}",
                    centerId, context.principal(), amount, e.getCode(), e.isRetryable(), e.getMessage());
            throw e;
        }
    }

    private void requireNoOverflow(Center center, long amount) {
        try {
            Math.addExact(center.getBalance(), amount);
            Math.addExact(center.getTotalContributions(), amount);
            Math.addExact(center.getTokenSupply(), amount);
        } catch (ArithmeticException e) {
            throw new InvalidAmountException(center.getId(), amount, e);
        }
    }
}
