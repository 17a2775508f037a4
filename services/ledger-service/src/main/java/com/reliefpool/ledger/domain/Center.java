package com.reliefpool.ledger.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.UUID;

/**
 * Relief center fund pool. Live instances belong to the ledger store; callers only
 * ever see {@link CenterSnapshot}s.
 *
 * Mutators assume the caller has already validated the request. They still refuse
 * to break the record's own invariants (non-negative balance, monotonic totals).
 * The only way to obtain a new record is {@link #open}, which assigns a fresh id.
 */
@Getter
@ToString
@Builder(toBuilder = true, access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Center {

    private final UUID id;
    private final String name;
    private final long createdEpoch;

    private long balance;
    private long totalContributions;
    private long tokenSupply;

    public static Center open(String name, long epoch) {
        Objects.requireNonNull(name, "name");
        return Center.builder()
                .id(UUID.randomUUID())
                .name(name)
                .createdEpoch(epoch)
                .balance(0L)
                .totalContributions(0L)
                .tokenSupply(0L)
                .build();
    }

    /**
     * Working copy for a unit of work.
     */
    public Center copy() {
        return toBuilder().build();
    }

    public void credit(long amount) {
        requirePositive(amount);
        balance = Math.addExact(balance, amount);
    }

    public void debit(long amount) {
        requirePositive(amount);
        if (amount > balance) {
            throw new IllegalStateException("Debit of " + amount + " would overdraw center " + id);
        }
        balance -= amount;
    }

    public void recordContribution(long amount) {
        requirePositive(amount);
        totalContributions = Math.addExact(totalContributions, amount);
    }

    public void recordIssuance(long quantity) {
        requirePositive(quantity);
        tokenSupply = Math.addExact(tokenSupply, quantity);
    }

    /**
     * Identity comparison on the store-assigned id, never on the display name.
     */
    public boolean isSameCenter(UUID otherId) {
        return id.equals(otherId);
    }

    public CenterSnapshot snapshot() {
        return new CenterSnapshot(id, name, balance, totalContributions, tokenSupply, createdEpoch);
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + amount);
        }
    }
}
