package uk.gegc.creatorbilling.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

/**
 * Request DTO for starting a subscription checkout.
 */
@Schema(name = "CreateSubscriptionRequest", description = "Request to start a subscription checkout for a plan")
public record CreateSubscriptionRequest(
        @Schema(description = "Plan to subscribe to", example = "550e8400-e29b-41d4-a716-446655440000", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Plan ID is required")
        UUID planId,

        @Schema(description = "Provider payment method reference to prefer at checkout", example = "pm_1234567890")
        @Size(max = 255, message = "Payment method reference must be at most 255 characters")
        String paymentMethodRef,

        @Schema(description = "Trial length in days", example = "14")
        @Min(value = 0, message = "Trial days cannot be negative")
        @Max(value = 730, message = "Trial days must be at most 730")
        Integer trialDays,

        @Schema(description = "Provider coupon code", example = "LAUNCH20")
        @Size(max = 100, message = "Coupon code must be at most 100 characters")
        String couponCode
) {}
