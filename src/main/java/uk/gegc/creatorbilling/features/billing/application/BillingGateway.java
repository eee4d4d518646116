package uk.gegc.creatorbilling.features.billing.application;

import uk.gegc.creatorbilling.features.billing.domain.exception.ExternalGatewayException;

import java.util.UUID;

/**
 * Capability interface to the external payment provider.
 *
 * <p>Every operation is synchronous and either returns a positive acknowledgement or throws
 * {@link ExternalGatewayException}. Implementations retry once on connection-level failures and never
 * retry on request (4xx) errors.
 */
public interface BillingGateway {

    /**
     * Short provider name recorded in the webhook ledger (e.g. {@code stripe}).
     */
    String providerName();

    CheckoutSession createCheckoutSession(CheckoutRequest request);

    void cancelSubscription(String externalSubscriptionId, boolean atPeriodEnd);

    void reactivateSubscription(String externalSubscriptionId);

    String openBillingPortal(String customerRef, String returnUrl);

    /**
     * Looks up an existing provider customer by email, creating one tagged with the subscriber id otherwise.
     */
    String resolveOrCreateCustomer(String email, String name, UUID subscriberId);

    /**
     * Provisions a monthly recurring price for a plan and returns its provider reference.
     */
    String createRecurringPrice(RecurringPriceRequest request);
}
