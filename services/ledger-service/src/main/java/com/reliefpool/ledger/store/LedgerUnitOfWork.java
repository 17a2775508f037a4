package com.reliefpool.ledger.store;

import com.reliefpool.ledger.audit.AuditRecord;
import com.reliefpool.ledger.domain.Center;
import com.reliefpool.ledger.domain.ContributionCredit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Working set of one ledger operation: copies of the enlisted centers plus the credits
 * and audit records the operation produces. Nothing here is visible to other operations
 * until the store commits it.
 */
public class LedgerUnitOfWork {

    private final Map<UUID, Center> workingCopies = new LinkedHashMap<>();
    private final List<ContributionCredit> issuedCredits = new ArrayList<>();
    private final List<AuditRecord> stagedRecords = new ArrayList<>();

    LedgerUnitOfWork(Collection<Center> enlisted) {
        for (Center center : enlisted) {
            workingCopies.put(center.getId(), center.copy());
        }
    }

    /**
     * Working copy of an enlisted center.
     *
     * @throws IllegalStateException if the center was not enlisted when the unit was opened
     */
    public Center center(UUID centerId) {
        Center center = workingCopies.get(centerId);
        if (center == null) {
            throw new IllegalStateException("Center " + centerId + " is not part of this unit of work");
        }
        return center;
    }

    public void issue(ContributionCredit credit) {
        center(credit.getCenterId());
        issuedCredits.add(credit);
    }

    /**
     * Stages a record for emission after commit, stamping its position within this operation.
     */
    public AuditRecord stage(AuditRecord record) {
        AuditRecord sequenced = record.withSequence(stagedRecords.size());
        stagedRecords.add(sequenced);
        return sequenced;
    }

    Collection<Center> workingCopies() {
        return Collections.unmodifiableCollection(workingCopies.values());
    }

    List<ContributionCredit> issuedCredits() {
        return Collections.unmodifiableList(issuedCredits);
    }

    List<AuditRecord> stagedRecords() {
        return Collections.unmodifiableList(stagedRecords);
    }
}
