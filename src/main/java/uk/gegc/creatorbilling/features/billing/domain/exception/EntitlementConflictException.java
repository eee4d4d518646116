package uk.gegc.creatorbilling.features.billing.domain.exception;

import java.util.UUID;

/**
 * Applying a transition would give a second subscription the live slot for the same (subscriber, plan),
 * or would attach an external subscription id already owned by another row. Retrying cannot fix it.
 */
public class EntitlementConflictException extends RuntimeException {

    private final UUID subscriptionId;

    public EntitlementConflictException(UUID subscriptionId, Throwable cause) {
        super("Transition of subscription " + subscriptionId + " violates a uniqueness constraint", cause);
        this.subscriptionId = subscriptionId;
    }

    public UUID getSubscriptionId() {
        return subscriptionId;
    }
}
