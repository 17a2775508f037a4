package com.reliefpool.ledger.domain;

import java.util.UUID;

/**
 * Immutable point-in-time view of a {@link Center}.
 */
public record CenterSnapshot(
        UUID id,
        String name,
        long balance,
        long totalContributions,
        long tokenSupply,
        long createdEpoch) {
}
