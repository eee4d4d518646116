package uk.gegc.creatorbilling.features.billing.application;

import uk.gegc.creatorbilling.features.billing.domain.model.BillingEvent;
import uk.gegc.creatorbilling.features.billing.domain.model.Subscription;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionTrigger;
import uk.gegc.creatorbilling.features.billing.domain.model.WebhookOutcome;

import java.util.UUID;

/**
 * Turns provider events and confirmed user actions into guarded subscription transitions.
 */
public interface ReconciliationService {

    /**
     * Records the event in the ledger and applies its transition in one transaction.
     * Stale, duplicate and unhandled events resolve to an ignored outcome rather than an exception.
     *
     * @throws uk.gegc.creatorbilling.features.billing.domain.exception.UnknownSubscriptionException when no local
     *         subscription matches the event; nothing is committed so a redelivery can succeed later
     * @throws uk.gegc.creatorbilling.features.billing.domain.exception.EntitlementConflictException when the
     *         transition would break a uniqueness invariant; nothing is committed
     */
    WebhookOutcome applyEvent(BillingEvent event);

    /**
     * Applies a user action whose provider call has already been acknowledged.
     * The action is stamped with the current time, or just after the row's last event when that is later.
     *
     * @param action one of {@link SubscriptionTrigger#CANCEL_SCHEDULED}, {@link SubscriptionTrigger#CANCELED_IMMEDIATELY}
     *               or {@link SubscriptionTrigger#REACTIVATED}
     * @return the subscription as committed after the write attempt
     */
    Subscription applyUserAction(UUID subscriptionId, SubscriptionTrigger action);
}
