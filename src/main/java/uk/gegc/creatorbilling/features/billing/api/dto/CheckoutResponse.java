package uk.gegc.creatorbilling.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "CheckoutResponse", description = "Checkout session created for a new subscription")
public record CheckoutResponse(
        @Schema(description = "Local subscription id, INCOMPLETE until checkout completes")
        UUID subscriptionId,

        @Schema(description = "Provider checkout page URL", example = "https://checkout.stripe.com/...")
        String checkoutUrl,

        @Schema(description = "Provider checkout session id", example = "cs_test_...")
        String sessionId
) {}
