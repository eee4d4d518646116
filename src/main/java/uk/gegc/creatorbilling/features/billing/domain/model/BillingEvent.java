package uk.gegc.creatorbilling.features.billing.domain.model;

import lombok.Builder;

import java.time.Instant;

/**
 * A verified inbound provider notification, translated to the provider-neutral shape the engine consumes.
 *
 * @param rawType          the provider's own event type string, kept for the ledger
 * @param type             null when the provider sent an event type the engine does not handle
 * @param providerStatus   provider-reported subscription status, already mapped; may be null
 * @param cancelAtPeriodEnd null when the event does not carry the flag
 */
@Builder
public record BillingEvent(
        String externalEventId,
        String provider,
        String rawType,
        BillingEventType type,
        Instant occurredAt,
        String externalSubscriptionId,
        String checkoutReference,
        SubscriptionStatus providerStatus,
        Instant currentPeriodStart,
        Instant currentPeriodEnd,
        Boolean cancelAtPeriodEnd
) {

    public boolean isHandled() {
        return type != null;
    }
}
