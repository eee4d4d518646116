package uk.gegc.creatorbilling.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Partial plan update; null fields are left unchanged.
 */
@Schema(name = "UpdatePlanRequest", description = "Partial update of a plan owned by the authenticated creator")
public record UpdatePlanRequest(
        @Size(min = 1, max = 100, message = "Name must be 1-100 characters")
        String name,

        @Size(min = 1, max = 500, message = "Description must be 1-500 characters")
        String description,

        @Min(value = 1, message = "Price must be positive")
        @Max(value = 100_000_000, message = "Price must be at most 100000000")
        Long price,

        @Pattern(regexp = "(?i)USD|EUR|GBP|CAD|AUD|JPY", message = "Currency must be one of USD, EUR, GBP, CAD, AUD, JPY")
        String currency,

        @Size(min = 1, max = 20, message = "Between 1 and 20 features are allowed")
        List<@NotBlank(message = "Feature must not be blank") @Size(max = 200, message = "Feature must be at most 200 characters") String> features,

        Boolean active
) {}
