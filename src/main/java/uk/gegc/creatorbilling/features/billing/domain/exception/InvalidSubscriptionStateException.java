package uk.gegc.creatorbilling.features.billing.domain.exception;

import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionStatus;

public class InvalidSubscriptionStateException extends RuntimeException {

    private final SubscriptionStatus currentStatus;

    public InvalidSubscriptionStateException(String message, SubscriptionStatus currentStatus) {
        super(message);
        this.currentStatus = currentStatus;
    }

    public SubscriptionStatus getCurrentStatus() {
        return currentStatus;
    }
}
