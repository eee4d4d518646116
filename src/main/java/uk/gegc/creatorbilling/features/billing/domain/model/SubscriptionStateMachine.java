package uk.gegc.creatorbilling.features.billing.domain.model;

import java.util.Optional;
import java.util.Set;

/**
 * Allowed edges between {@link SubscriptionStatus} values.
 * Self-edges on ACTIVE and PAST_DUE are refreshes: the status stays, the billing period and ordering timestamp move.
 */
public enum SubscriptionStateMachine {
    INCOMPLETE(Set.of(SubscriptionStatus.ACTIVE, SubscriptionStatus.INCOMPLETE)),
    ACTIVE(Set.of(SubscriptionStatus.ACTIVE, SubscriptionStatus.PAST_DUE, SubscriptionStatus.CANCELED)),
    PAST_DUE(Set.of(SubscriptionStatus.PAST_DUE, SubscriptionStatus.ACTIVE, SubscriptionStatus.CANCELED)),
    CANCELED(Set.of());

    private final Set<SubscriptionStatus> allowedTransitions;

    SubscriptionStateMachine(Set<SubscriptionStatus> allowedTransitions) {
        this.allowedTransitions = allowedTransitions;
    }

    public boolean canTransitionTo(SubscriptionStatus targetStatus) {
        if (targetStatus == null) {
            return false;
        }
        return allowedTransitions.contains(targetStatus);
    }

    public static boolean isValidTransition(SubscriptionStatus from, SubscriptionStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return SubscriptionStateMachine.valueOf(from.name()).canTransitionTo(to);
    }

    /**
     * Resolves the status a trigger moves a subscription to, or empty when the trigger is not valid
     * from {@code current}.
     *
     * @param providerStatus the provider-reported status; only consulted for {@link SubscriptionTrigger#PROVIDER_UPDATED},
     *                       where null keeps the current status
     */
    public static Optional<SubscriptionStatus> targetFor(SubscriptionStatus current,
                                                         SubscriptionTrigger trigger,
                                                         SubscriptionStatus providerStatus) {
        if (current == null || trigger == null) {
            return Optional.empty();
        }
        SubscriptionStatus target = switch (trigger) {
            case CHECKOUT_COMPLETED -> current == SubscriptionStatus.INCOMPLETE ? SubscriptionStatus.ACTIVE : null;
            case PAYMENT_SUCCEEDED -> SubscriptionStatus.ACTIVE;
            case PAYMENT_FAILED -> current == SubscriptionStatus.INCOMPLETE ? null : SubscriptionStatus.PAST_DUE;
            case PROVIDER_DELETED -> current.holdsEntitlementSlot() ? SubscriptionStatus.CANCELED : null;
            case CANCELED_IMMEDIATELY -> current == SubscriptionStatus.ACTIVE ? SubscriptionStatus.CANCELED : null;
            case CANCEL_SCHEDULED, REACTIVATED -> current == SubscriptionStatus.ACTIVE ? SubscriptionStatus.ACTIVE : null;
            case PROVIDER_UPDATED -> providerStatus != null ? providerStatus : current;
        };
        if (target == null || !isValidTransition(current, target)) {
            return Optional.empty();
        }
        return Optional.of(target);
    }
}
