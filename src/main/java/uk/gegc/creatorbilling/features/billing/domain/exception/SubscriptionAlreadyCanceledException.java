package uk.gegc.creatorbilling.features.billing.domain.exception;

import java.util.UUID;

/**
 * The provider-side subscription no longer exists, so it cannot be reactivated or canceled again.
 */
public class SubscriptionAlreadyCanceledException extends RuntimeException {
    public SubscriptionAlreadyCanceledException(UUID subscriptionId) {
        super("Subscription " + subscriptionId + " has already been canceled");
    }
}
