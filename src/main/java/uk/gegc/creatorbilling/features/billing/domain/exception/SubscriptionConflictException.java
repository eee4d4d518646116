package uk.gegc.creatorbilling.features.billing.domain.exception;

import java.util.UUID;

/**
 * The (subscriber, plan) pair already holds a live subscription.
 */
public class SubscriptionConflictException extends RuntimeException {

    private final UUID subscriberId;
    private final UUID planId;

    public SubscriptionConflictException(UUID subscriberId, UUID planId) {
        super("Subscriber " + subscriberId + " already has an active or past-due subscription to plan " + planId);
        this.subscriberId = subscriberId;
        this.planId = planId;
    }

    public UUID getSubscriberId() {
        return subscriberId;
    }

    public UUID getPlanId() {
        return planId;
    }
}
