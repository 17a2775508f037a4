package com.reliefpool.ledger.service;

import com.reliefpool.common.exception.BusinessException;
import com.reliefpool.ledger.audit.FundsTransferredRecord;
import com.reliefpool.ledger.audit.FundsWithdrawnRecord;
import com.reliefpool.ledger.context.OperationContext;
import com.reliefpool.ledger.domain.Center;
import com.reliefpool.ledger.exception.InsufficientFundsException;
import com.reliefpool.ledger.exception.InvalidAmountException;
import com.reliefpool.ledger.exception.SelfTransferException;
import com.reliefpool.ledger.metrics.LedgerMetricsService;
import com.reliefpool.ledger.security.AuthorizationCapability;
import com.reliefpool.ledger.security.CapabilityAuthority;
import com.reliefpool.ledger.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Privileged fund movements: center to center, and center to an external recipient.
 *
 * Checks run in a fixed order (capability, self-transfer, amount, funds) inside the unit
 * of work, so a rejected request never mutates a center or emits a record.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FundsMovementService {

    private final LedgerStore ledgerStore;
    private final CapabilityAuthority capabilityAuthority;
    private final LedgerMetricsService metricsService;

    /**
     * Moves {@code amount} from one center to another. Both centers are held for the whole
     * operation, so the pair's combined balance is the same before and after.
     */
    public void transferBetweenCenters(UUID fromCenterId,
                                       UUID toCenterId,
                                       long amount,
                                       AuthorizationCapability capability,
                                       OperationContext context) {
        Objects.requireNonNull(fromCenterId, "fromCenterId");
        Objects.requireNonNull(toCenterId, "toCenterId");
        Objects.requireNonNull(context, "context");

        try {
            ledgerStore.execute(List.of(fromCenterId, toCenterId), unit -> {
                Center source = unit.center(fromCenterId);
                capabilityAuthority.requireAuthorized(capability, source);

                if (fromCenterId.equals(toCenterId)) {
                    throw new SelfTransferException(fromCenterId);
                }
                Center destination = unit.center(toCenterId);

                requireWithdrawable(source, amount);
                try {
                    Math.addExact(destination.getBalance(), amount);
                } catch (ArithmeticException e) {
                    throw new InvalidAmountException(toCenterId, amount, e);
                }

                source.debit(amount);
                destination.credit(amount);

                unit.stage(FundsTransferredRecord.builder()
                        .fromCenterId(fromCenterId)
                        .toCenterId(toCenterId)
                        .initiator(context.principal())
                        .amount(amount)
                        .epoch(context.epoch())
                        .build());
                return null;
            });

            metricsService.recordTransfer(amount);
            log.info("Transfer completed: from={}, to={}, amount={}, by={}, epoch={}",
                    fromCenterId, toCenterId, amount, context.principal(), context.epoch());

        } catch (BusinessException e) {
            metricsService.recordRejection("transfer", e.getErrorCode());
            log.warn("Transfer rejected: from={}, to={}, amount={}, code={}, retryable={}, reason={}",
                    fromCenterId, toCenterId, amount, e.getCode(), e.isRetryable(), e.getMessage());
            throw e;
        }
    }

    /**
     * Pays {@code amount} out of a center to an external recipient. The amount leaves the
     * ledger; no other center is credited.
     */
    public void withdrawFunds(UUID centerId,
                              long amount,
                              String recipient,
                              AuthorizationCapability capability,
                              OperationContext context) {
        Objects.requireNonNull(centerId, "centerId");
        Objects.requireNonNull(recipient, "recipient");
        Objects.requireNonNull(context, "context");

        try {
            ledgerStore.execute(List.of(centerId), unit -> {
                Center center = unit.center(centerId);
                capabilityAuthority.requireAuthorized(capability, center);
                requireWithdrawable(center, amount);

                center.debit(amount);

                unit.stage(FundsWithdrawnRecord.builder()
                        .centerId(centerId)
                        .recipient(recipient)
                        .initiator(context.principal())
                        .amount(amount)
                        .epoch(context.epoch())
                        .build());
                return null;
            });

            metricsService.recordWithdrawal(amount);
            log.info("Withdrawal completed: center={}, recipient={}, amount={}, by={}, epoch={}",
                    centerId, recipient, amount, context.principal(), context.epoch());

        } catch (BusinessException e) {
            metricsService.recordRejection("withdraw", e.getErrorCode());
            log.warn("Withdrawal rejected: center={}, recipient={}, amount={}, code={}, retryable={}, reason={}",
                    centerId, recipient, amount, e.getCode(), e.isRetryable(), e.getMessage());
            throw e;
        }
    }

    private void requireWithdrawable(Center center, long amount) {
        if (amount <= 0) {
            throw new InvalidAmountException(center.getId(), amount);
        }
        if (amount > center.getBalance()) {
            throw new InsufficientFundsException(center.getId(), amount, center.getBalance());
        }
    }
}
