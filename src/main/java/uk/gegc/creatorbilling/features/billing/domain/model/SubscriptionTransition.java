package uk.gegc.creatorbilling.features.billing.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.UUID;

/**
 * Full target row image for one guarded subscription write. The write only lands if the row still has
 * {@code expectedStatus} and its {@code lastEventAt} is strictly earlier than {@code occurredAt}.
 */
@Builder(toBuilder = true)
public record SubscriptionTransition(
        UUID subscriptionId,
        SubscriptionStatus expectedStatus,
        SubscriptionStatus targetStatus,
        String externalSubscriptionId,
        boolean cancelAtPeriodEnd,
        Instant currentPeriodStart,
        Instant currentPeriodEnd,
        Instant activatedAt,
        Instant canceledAt,
        String entitlementKey,
        Instant occurredAt,
        Instant updatedAt
) {

    /**
     * Starts a transition from the current row image, carrying over everything the caller does not change
     * and deriving the entitlement key, activation and cancellation stamps from the target status.
     */
    public static SubscriptionTransition from(Subscription current,
                                              SubscriptionStatus target,
                                              Instant occurredAt,
                                              Instant now) {
        Instant activatedAt = current.getActivatedAt();
        if (activatedAt == null && target == SubscriptionStatus.ACTIVE) {
            activatedAt = occurredAt;
        }
        Instant canceledAt = target == SubscriptionStatus.CANCELED ? occurredAt : current.getCanceledAt();
        String entitlementKey = target.holdsEntitlementSlot()
                ? Subscription.entitlementKeyFor(current.getSubscriberId(), current.getPlanId())
                : null;

        return new SubscriptionTransition(
                current.getId(),
                current.getStatus(),
                target,
                current.getExternalSubscriptionId(),
                current.isCancelAtPeriodEnd(),
                current.getCurrentPeriodStart(),
                current.getCurrentPeriodEnd(),
                activatedAt,
                canceledAt,
                entitlementKey,
                occurredAt,
                now
        );
    }

    public boolean changesStatus() {
        return expectedStatus != targetStatus;
    }
}
