package uk.gegc.creatorbilling.features.subscriber.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "UpsertSubscriberRequest", description = "Billing profile of the authenticated subscriber")
public record UpsertSubscriberRequest(
        @Schema(description = "Email used for the billing provider customer", example = "reader@example.com")
        @NotBlank(message = "Email is required")
        @Email(message = "Email must be valid")
        @Size(max = 254, message = "Email must be at most 254 characters")
        String email,

        @Schema(description = "Display name", example = "Ada Reader")
        @NotBlank(message = "Name is required")
        @Size(max = 100, message = "Name must be at most 100 characters")
        String name
) {}
