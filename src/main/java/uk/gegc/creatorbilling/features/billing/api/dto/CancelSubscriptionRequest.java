package uk.gegc.creatorbilling.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "CancelSubscriptionRequest", description = "Cancellation options")
public record CancelSubscriptionRequest(
        @Schema(description = "Cancel now instead of at the end of the current period", example = "false")
        Boolean immediately
) {
    public boolean isImmediate() {
        return Boolean.TRUE.equals(immediately);
    }
}
