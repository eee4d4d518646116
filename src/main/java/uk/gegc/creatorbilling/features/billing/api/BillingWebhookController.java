package uk.gegc.creatorbilling.features.billing.api;

import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.creatorbilling.features.billing.application.BillingProperties;
import uk.gegc.creatorbilling.features.billing.application.BillingWebhookService;
import uk.gegc.creatorbilling.features.billing.domain.model.WebhookOutcome;
import uk.gegc.creatorbilling.features.billing.infra.webhook.SignedEnvelopeEventReader;
import uk.gegc.creatorbilling.features.billing.infra.webhook.StripeEventReader;
import uk.gegc.creatorbilling.shared.config.FeatureFlags;

@Slf4j
@RestController
@RequestMapping("/api/v1/billing")
@RequiredArgsConstructor
@Tag(name = "Billing Webhooks", description = "Internal endpoints for billing provider events (not for public use)")
public class BillingWebhookController {

    private final BillingWebhookService webhookService;
    private final BillingProperties billingProperties;
    private final FeatureFlags featureFlags;

    @Operation(
            summary = "Handle signed billing event",
            description = "Canonical provider envelope signed with a hex HMAC-SHA256 of the raw body."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event applied, ignored or recorded as failed"),
            @ApiResponse(responseCode = "400", description = "Invalid signature or malformed payload",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Billing feature disabled",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Processing failed; the provider should retry",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @Hidden // Hide from public Swagger UI
    @PostMapping("/webhook")
    public ResponseEntity<String> handleBillingWebhook(
            @Parameter(hidden = true) @RequestBody String payload,
            HttpServletRequest request
    ) {
        if (!featureFlags.isBilling()) {
            log.warn("Billing feature is disabled, rejecting webhook");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("");
        }
        String signature = request.getHeader(billingProperties.getSignatureHeader());
        return acknowledge(webhookService.process(SignedEnvelopeEventReader.PROVIDER, payload, signature));
    }

    @Operation(
            summary = "Handle Stripe webhook",
            description = "Native Stripe events, verified with the Stripe-Signature header."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event applied, ignored or recorded as failed"),
            @ApiResponse(responseCode = "400", description = "Invalid signature",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Billing feature or Stripe webhooks disabled",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @Hidden // Hide from public Swagger UI
    @PostMapping("/stripe/webhook")
    public ResponseEntity<String> handleStripeWebhook(
            @Parameter(hidden = true) @RequestBody String payload,
            @Parameter(description = "Stripe signature header for verification") @RequestHeader(name = "Stripe-Signature", required = false) String sigHeader
    ) {
        if (!featureFlags.isBilling() || !featureFlags.isStripeWebhooks()) {
            log.warn("Stripe webhooks are disabled, rejecting webhook");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("");
        }
        return acknowledge(webhookService.process(StripeEventReader.PROVIDER, payload, sigHeader));
    }

    private ResponseEntity<String> acknowledge(WebhookOutcome outcome) {
        return ResponseEntity.ok(switch (outcome) {
            case APPLIED, IGNORED_STALE, IGNORED_DUPLICATE, IGNORED_UNHANDLED, FAILED -> "";
        });
    }
}
