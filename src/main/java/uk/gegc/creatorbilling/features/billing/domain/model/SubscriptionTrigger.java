package uk.gegc.creatorbilling.features.billing.domain.model;

/**
 * What caused a subscription transition. The last three are direct user actions.
 */
public enum SubscriptionTrigger {
    CHECKOUT_COMPLETED,
    PAYMENT_SUCCEEDED,
    PAYMENT_FAILED,
    PROVIDER_UPDATED,
    PROVIDER_DELETED,
    CANCELED_IMMEDIATELY,
    CANCEL_SCHEDULED,
    REACTIVATED
}
