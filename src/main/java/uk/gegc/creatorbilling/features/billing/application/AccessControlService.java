package uk.gegc.creatorbilling.features.billing.application;

import uk.gegc.creatorbilling.features.billing.domain.model.AccessLevel;

import java.util.UUID;

/**
 * Read-only entitlement checks against committed subscription state.
 */
public interface AccessControlService {

    /**
     * True iff the subscriber holds an ACTIVE subscription to the plan. PAST_DUE does not grant access.
     */
    boolean hasEntitlement(UUID subscriberId, UUID planId);

    AccessLevel accessLevel(UUID subscriberId);
}
