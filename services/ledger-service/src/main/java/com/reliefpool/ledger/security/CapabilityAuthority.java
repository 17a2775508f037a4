package com.reliefpool.ledger.security;

import com.reliefpool.ledger.domain.Center;
import com.reliefpool.ledger.exception.UnauthorizedAccessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Issues and checks center capabilities.
 *
 * Authorization is possession: a capability authorizes exactly the center whose id it
 * carries. The invoking principal plays no part. Every check fails closed.
 */
@Slf4j
@Component
public class CapabilityAuthority {

    /**
     * Mints the capability for a center that is being opened. Called once per center.
     */
    public AuthorizationCapability issueFor(Center center) {
        AuthorizationCapability capability = AuthorizationCapability.mint(center.getId());
        log.debug("Issued capability {} for center {}", capability.getId(), center.getId());
        return capability;
    }

    public boolean authorize(AuthorizationCapability capability, Center target) {
        if (capability == null || target == null) {
            return false;
        }
        return target.isSameCenter(capability.getCenterId());
    }

    /**
     * @throws UnauthorizedAccessException unless {@link #authorize} holds
     */
    public void requireAuthorized(AuthorizationCapability capability, Center target) {
        if (!authorize(capability, target)) {
            log.warn("SECURITY: Rejected capability {} for center {}",
                    capability != null ? capability.getId() : null,
                    target != null ? target.getId() : null);
            throw new UnauthorizedAccessException(
                    target != null ? target.getId() : null,
                    capability != null ? capability.getCenterId() : null);
        }
    }
}
