package uk.gegc.creatorbilling.features.billing.infra.webhook;

import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionStatus;

import java.util.Locale;

/**
 * Maps provider subscription status strings onto local statuses.
 */
final class ProviderStatusMapper {

    private ProviderStatusMapper() {
    }

    static SubscriptionStatus toLocal(String providerStatus) {
        if (providerStatus == null) {
            return null;
        }
        return switch (providerStatus.toLowerCase(Locale.ROOT)) {
            case "active", "trialing" -> SubscriptionStatus.ACTIVE;
            case "past_due" -> SubscriptionStatus.PAST_DUE;
            case "canceled", "cancelled", "unpaid" -> SubscriptionStatus.CANCELED;
            case "incomplete", "incomplete_expired" -> SubscriptionStatus.INCOMPLETE;
            default -> SubscriptionStatus.ACTIVE;
        };
    }
}
