package uk.gegc.creatorbilling.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

@Schema(name = "CreatePlanRequest", description = "New subscription plan offered by the authenticated creator")
public record CreatePlanRequest(
        @NotBlank(message = "Name is required")
        @Size(max = 100, message = "Name must be at most 100 characters")
        String name,

        @NotBlank(message = "Description is required")
        @Size(max = 500, message = "Description must be at most 500 characters")
        String description,

        @Schema(description = "Monthly price in minor currency units", example = "999")
        @NotNull(message = "Price is required")
        @Min(value = 1, message = "Price must be positive")
        @Max(value = 100_000_000, message = "Price must be at most 100000000")
        Long price,

        @Schema(description = "ISO 4217 currency code", example = "USD")
        @NotBlank(message = "Currency is required")
        @Pattern(regexp = "(?i)USD|EUR|GBP|CAD|AUD|JPY", message = "Currency must be one of USD, EUR, GBP, CAD, AUD, JPY")
        String currency,

        @NotEmpty(message = "At least one feature is required")
        @Size(max = 20, message = "At most 20 features are allowed")
        List<@NotBlank(message = "Feature must not be blank") @Size(max = 200, message = "Feature must be at most 200 characters") String> features,

        @Schema(description = "Existing provider price to use instead of provisioning one", example = "price_123")
        @Size(max = 100, message = "External price ID must be at most 100 characters")
        String externalPriceId
) {}
