package com.reliefpool.ledger.domain;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Credit issued to a donor, one per donation, with a quantity equal to the donated amount.
 * Credits are never merged, burned or redeemed.
 */
@Value
@Builder
public class ContributionCredit {

    UUID id;
    UUID centerId;
    String owner;
    long quantity;
    long issuedEpoch;
}
