package com.reliefpool.ledger.security;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.UUID;

/**
 * Bearer credential for one center. Whoever holds it may move that center's funds.
 * <p>
 * Only {@link CapabilityAuthority} can mint one, and only while opening a center, so a
 * capability cannot be derived from an existing center afterwards.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuthorizationCapability {

    UUID id;
    UUID centerId;

    static AuthorizationCapability mint(UUID centerId) {
        return new AuthorizationCapability(UUID.randomUUID(), centerId);
    }
}
