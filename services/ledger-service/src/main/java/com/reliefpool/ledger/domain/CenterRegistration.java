package com.reliefpool.ledger.domain;

import com.reliefpool.ledger.security.AuthorizationCapability;

/**
 * Result of opening a center: the new record and the only capability that will ever
 * authorize privileged operations on it.
 */
public record CenterRegistration(CenterSnapshot center, AuthorizationCapability capability) {
}
