package com.reliefpool.ledger.service;

import com.reliefpool.ledger.context.OperationContext;
import com.reliefpool.ledger.domain.Center;
import com.reliefpool.ledger.domain.CenterRegistration;
import com.reliefpool.ledger.domain.CenterSnapshot;
import com.reliefpool.ledger.domain.ContributionCredit;
import com.reliefpool.ledger.exception.CenterNotFoundException;
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
 * Opens centers and answers read queries. Performs no authorization: reads are public
 * and opening a center is open to any principal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CenterRegistryService {

    private final LedgerStore ledgerStore;
    private final CapabilityAuthority capabilityAuthority;
    private final LedgerMetricsService metricsService;

    /**
     * Opens a center with zero balance, contributions and credit supply.
     *
     * @return the new center and its capability; the capability is not kept anywhere else
     */
    public CenterRegistration createCenter(String name, OperationContext context) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(context, "context");

        Center center = Center.open(name, context.epoch());
        AuthorizationCapability capability = capabilityAuthority.issueFor(center);
        ledgerStore.insert(center);
        metricsService.recordCenterCreated();

        log.info("Center opened: id={}, name={}, by={}, epoch={}",
                center.getId(), name, context.principal(), context.epoch());

        return new CenterRegistration(center.snapshot(), capability);
    }

    public CenterSnapshot getCenter(UUID centerId) {
        return ledgerStore.findCenter(centerId)
                .orElseThrow(() -> new CenterNotFoundException(centerId));
    }

    public long balanceOf(UUID centerId) {
        return getCenter(centerId).balance();
    }

    public long totalContributions(UUID centerId) {
        return getCenter(centerId).totalContributions();
    }

    public long tokenSupply(UUID centerId) {
        return getCenter(centerId).tokenSupply();
    }

    public List<ContributionCredit> creditsIssuedAgainst(UUID centerId) {
        return ledgerStore.creditsIssuedAgainst(centerId);
    }

    public List<ContributionCredit> creditsOwnedBy(String owner) {
        return ledgerStore.creditsOwnedBy(owner);
    }
}
