package uk.gegc.creatorbilling.features.billing.application;

import uk.gegc.creatorbilling.features.billing.api.dto.BillingPortalResponse;
import uk.gegc.creatorbilling.features.billing.api.dto.CheckoutResponse;
import uk.gegc.creatorbilling.features.billing.api.dto.CreateSubscriptionRequest;
import uk.gegc.creatorbilling.features.billing.api.dto.SubscriptionDto;

import java.util.List;
import java.util.UUID;

/**
 * User-initiated subscription actions. Each action calls the billing provider first and only then
 * records the confirmed change locally.
 */
public interface SubscriptionService {

    /**
     * Opens a provider checkout for the plan and records an INCOMPLETE subscription.
     *
     * @throws uk.gegc.creatorbilling.features.billing.domain.exception.SubscriptionConflictException if the
     *         subscriber already holds an ACTIVE or PAST_DUE subscription to the plan
     */
    CheckoutResponse createSubscription(UUID subscriberId, CreateSubscriptionRequest request);

    SubscriptionDto getSubscription(UUID subscriptionId, Requester requester);

    List<SubscriptionDto> listSubscriptions(UUID subscriberId);

    List<SubscriptionDto> listActiveSubscriptions(UUID subscriberId);

    /**
     * Cancels at period end by default: the subscription stays ACTIVE with {@code cancelAtPeriodEnd} set
     * until the provider confirms deletion. An immediate cancel moves it to CANCELED.
     */
    SubscriptionDto cancelSubscription(UUID subscriptionId, Requester requester, boolean immediately);

    /**
     * Withdraws a pending period-end cancellation. Only valid while ACTIVE with {@code cancelAtPeriodEnd} set.
     */
    SubscriptionDto reactivateSubscription(UUID subscriptionId, Requester requester);

    BillingPortalResponse openBillingPortal(UUID subscriberId, String returnUrl);
}
