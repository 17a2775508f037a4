package com.reliefpool.ledger.store;

import com.reliefpool.ledger.domain.Center;
import com.reliefpool.ledger.domain.CenterSnapshot;
import com.reliefpool.ledger.domain.ContributionCredit;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Contract with the substrate that persists and sequences center records.
 * <p>
 * {@link #execute} is the only way to mutate a center. Every center named in
 * {@code centerIds} is held exclusively for the duration of {@code work}; when
 * {@code work} returns, all working copies, issued credits and staged audit records
 * are committed together. When it throws, none of them are.
 */
public interface LedgerStore {

    void insert(Center center);

    Optional<CenterSnapshot> findCenter(UUID centerId);

    <T> T execute(Collection<UUID> centerIds, Function<LedgerUnitOfWork, T> work);

    /**
     * Credits issued against a center, in issue order.
     */
    List<ContributionCredit> creditsIssuedAgainst(UUID centerId);

    List<ContributionCredit> creditsOwnedBy(String owner);
}
