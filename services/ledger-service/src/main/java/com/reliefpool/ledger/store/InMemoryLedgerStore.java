package com.reliefpool.ledger.store;

import com.reliefpool.ledger.audit.AuditEventEmitter;
import com.reliefpool.ledger.audit.AuditRecord;
import com.reliefpool.ledger.audit.LoggingAuditEventEmitter;
import com.reliefpool.ledger.domain.Center;
import com.reliefpool.ledger.domain.CenterSnapshot;
import com.reliefpool.ledger.domain.ContributionCredit;
import com.reliefpool.ledger.exception.CenterNotFoundException;
import com.reliefpool.ledger.exception.LedgerConcurrencyException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-process ledger substrate.
 *
 * Each center has its own lock. A unit of work takes the locks of all its centers in
 * ascending id order, so two operations over the same pair of centers can never wait on
 * each other in a cycle. Lock waits are bounded by {@code lockTimeout}.
 *
 * Live records are replaced on commit, never mutated in place, which lets
 * {@link #findCenter} read without locking.
 *
 * Staged audit records are emitted after commit. A record the primary sink rejects goes to
 * the fallback sink, so a committed operation always reports success and all of its
 * records are emitted in staging order.
 */
@Slf4j
public class InMemoryLedgerStore implements LedgerStore {

    private final Map<UUID, Center> centers = new ConcurrentHashMap<>();
    private final Map<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<UUID, List<ContributionCredit>> creditsByCenter = new ConcurrentHashMap<>();
    private final Map<String, List<ContributionCredit>> creditsByOwner = new ConcurrentHashMap<>();

    private final Duration lockTimeout;
    private final AuditEventEmitter auditEventEmitter;
    private final AuditEventEmitter fallbackEmitter;

    public InMemoryLedgerStore(Duration lockTimeout, AuditEventEmitter auditEventEmitter) {
        this(lockTimeout, auditEventEmitter, new LoggingAuditEventEmitter());
    }

    public InMemoryLedgerStore(Duration lockTimeout,
                               AuditEventEmitter auditEventEmitter,
                               AuditEventEmitter fallbackEmitter) {
        if (lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalArgumentException("lockTimeout must be positive: " + lockTimeout);
        }
        this.lockTimeout = lockTimeout;
        this.auditEventEmitter = auditEventEmitter;
        this.fallbackEmitter = fallbackEmitter;
    }

    @Override
    public void insert(Center center) {
        Center stored = center.copy();
        if (centers.putIfAbsent(stored.getId(), stored) != null) {
            throw new IllegalStateException("Center already exists: " + stored.getId());
        }
        locks.put(stored.getId(), new ReentrantLock());
        creditsByCenter.put(stored.getId(), new CopyOnWriteArrayList<>());
        log.debug("Stored center {} ({})", stored.getId(), stored.getName());
    }

    @Override
    public Optional<CenterSnapshot> findCenter(UUID centerId) {
        Center center = centers.get(centerId);
        return center == null ? Optional.empty() : Optional.of(center.snapshot());
    }

    @Override
    public <T> T execute(Collection<UUID> centerIds, Function<LedgerUnitOfWork, T> work) {
        SortedSet<UUID> ordered = new TreeSet<>(centerIds);
        Deque<ReentrantLock> held = new ArrayDeque<>();
        try {
            for (UUID centerId : ordered) {
                held.push(acquire(centerId));
            }

            List<Center> enlisted = new ArrayList<>(ordered.size());
            for (UUID centerId : ordered) {
                enlisted.add(centers.get(centerId));
            }

            LedgerUnitOfWork unit = new LedgerUnitOfWork(enlisted);
            T result = work.apply(unit);
            commit(unit);
            return result;
        } finally {
            while (!held.isEmpty()) {
                held.pop().unlock();
            }
        }
    }

    @Override
    public List<ContributionCredit> creditsIssuedAgainst(UUID centerId) {
        List<ContributionCredit> credits = creditsByCenter.get(centerId);
        if (credits == null) {
            throw new CenterNotFoundException(centerId);
        }
        return List.copyOf(credits);
    }

    @Override
    public List<ContributionCredit> creditsOwnedBy(String owner) {
        return List.copyOf(creditsByOwner.getOrDefault(owner, List.of()));
    }

    private ReentrantLock acquire(UUID centerId) {
        ReentrantLock lock = locks.get(centerId);
        if (lock == null) {
            throw new CenterNotFoundException(centerId);
        }
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Timed out after {} waiting for center {}", lockTimeout, centerId);
                throw new LedgerConcurrencyException(centerId, lockTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerConcurrencyException(centerId, e);
        }
        log.debug("Locked center {}", centerId);
        return lock;
    }

    /**
     * Runs with every enlisted lock held. Records are emitted after the state is written so
     * a record is never observed for a change that did not happen. Nothing after the first
     * write may throw.
     */
    private void commit(LedgerUnitOfWork unit) {
        for (Center center : unit.workingCopies()) {
            centers.put(center.getId(), center);
        }
        for (ContributionCredit credit : unit.issuedCredits()) {
            creditsByCenter.get(credit.getCenterId()).add(credit);
            creditsByOwner.computeIfAbsent(credit.getOwner(), owner -> new CopyOnWriteArrayList<>()).add(credit);
        }
        for (AuditRecord record : unit.stagedRecords()) {
            publish(record);
        }
    }

    private void publish(AuditRecord record) {
        try {
            auditEventEmitter.emit(record);
        } catch (RuntimeException e) {
            log.error("Audit sink failed for committed record, using fallback: type={}, recordId={}, center={}",
                    record.getRecordType(), record.getRecordId(), record.getPrimaryCenterId(), e);
            fallbackEmitter.emit(record);
        }
    }
}
