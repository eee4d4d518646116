package uk.gegc.creatorbilling.features.billing.domain.model;

import java.util.Optional;

/**
 * Provider-neutral kinds of billing notification the reconciliation engine understands.
 */
public enum BillingEventType {
    CHECKOUT_COMPLETED("checkout.completed", SubscriptionTrigger.CHECKOUT_COMPLETED),
    PAYMENT_SUCCEEDED("payment.succeeded", SubscriptionTrigger.PAYMENT_SUCCEEDED),
    PAYMENT_FAILED("payment.failed", SubscriptionTrigger.PAYMENT_FAILED),
    SUBSCRIPTION_UPDATED("subscription.updated", SubscriptionTrigger.PROVIDER_UPDATED),
    SUBSCRIPTION_DELETED("subscription.deleted", SubscriptionTrigger.PROVIDER_DELETED);

    private final String wireName;
    private final SubscriptionTrigger trigger;

    BillingEventType(String wireName, SubscriptionTrigger trigger) {
        this.wireName = wireName;
        this.trigger = trigger;
    }

    public String wireName() {
        return wireName;
    }

    public SubscriptionTrigger trigger() {
        return trigger;
    }

    public static Optional<BillingEventType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (BillingEventType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
