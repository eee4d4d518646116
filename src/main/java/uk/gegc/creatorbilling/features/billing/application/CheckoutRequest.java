package uk.gegc.creatorbilling.features.billing.application;

import lombok.Builder;

import java.util.UUID;

/**
 * @param checkoutReference our correlation id, echoed back by the provider on checkout completion
 */
@Builder
public record CheckoutRequest(
        String customerRef,
        String externalPriceId,
        Integer trialDays,
        String couponCode,
        String checkoutReference,
        UUID subscriberId,
        UUID planId,
        String paymentMethodRef
) {
}
