package uk.gegc.creatorbilling.features.billing.domain.model;

/**
 * Local lifecycle of a subscription. {@link #CANCELED} is terminal: a new checkout always creates a new row.
 */
public enum SubscriptionStatus {
    INCOMPLETE,
    ACTIVE,
    PAST_DUE,
    CANCELED;

    /**
     * Statuses that hold the (subscriber, plan) entitlement slot.
     */
    public boolean holdsEntitlementSlot() {
        return this == ACTIVE || this == PAST_DUE;
    }

    public boolean isTerminal() {
        return this == CANCELED;
    }
}
