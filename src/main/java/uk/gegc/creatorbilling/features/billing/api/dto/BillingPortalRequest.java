package uk.gegc.creatorbilling.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

public record BillingPortalRequest(
        @Schema(description = "Where the portal returns the subscriber to; defaults to the configured URL")
        @Size(max = 2048, message = "Return URL is too long")
        String returnUrl
) {}
