package uk.gegc.creatorbilling.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.creatorbilling.features.billing.api.dto.AccessLevelDto;
import uk.gegc.creatorbilling.features.billing.api.dto.BillingPortalRequest;
import uk.gegc.creatorbilling.features.billing.api.dto.BillingPortalResponse;
import uk.gegc.creatorbilling.features.billing.api.dto.CancelSubscriptionRequest;
import uk.gegc.creatorbilling.features.billing.api.dto.CheckoutResponse;
import uk.gegc.creatorbilling.features.billing.api.dto.ChurnRateDto;
import uk.gegc.creatorbilling.features.billing.api.dto.CreateSubscriptionRequest;
import uk.gegc.creatorbilling.features.billing.api.dto.EntitlementDto;
import uk.gegc.creatorbilling.features.billing.api.dto.PlanStatsDto;
import uk.gegc.creatorbilling.features.billing.api.dto.SubscriptionDto;
import uk.gegc.creatorbilling.features.billing.api.dto.SubscriptionStatsDto;
import uk.gegc.creatorbilling.features.billing.application.AccessControlService;
import uk.gegc.creatorbilling.features.billing.application.SubscriptionMetricsService;
import uk.gegc.creatorbilling.features.billing.application.SubscriptionService;
import uk.gegc.creatorbilling.shared.config.FeatureFlags;

import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/subscriptions")
@RequiredArgsConstructor
@Validated
@Tag(name = "Subscriptions", description = "Subscription checkout, cancellation, entitlements and creator statistics")
@SecurityRequirement(name = "Bearer Authentication")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final AccessControlService accessControlService;
    private final SubscriptionMetricsService metricsService;
    private final FeatureFlags featureFlags;

    @Operation(
            summary = "Start a subscription",
            description = "Opens a provider checkout for the plan. The subscription stays INCOMPLETE until the provider confirms payment."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Checkout created",
                    content = @Content(schema = @Schema(implementation = CheckoutResponse.class))),
            @ApiResponse(responseCode = "404", description = "Plan not found or not available",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Subscriber already holds an active subscription to the plan",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Billing provider error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<CheckoutResponse> createSubscription(@Valid @RequestBody CreateSubscriptionRequest request) {
        if (!featureFlags.isBilling()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        CheckoutResponse response = subscriptionService.createSubscription(BillingSecurityUtils.getCurrentUserId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "List my subscriptions", description = "All subscriptions of the caller, newest first")
    @GetMapping("/my")
    public ResponseEntity<List<SubscriptionDto>> listMySubscriptions() {
        return ResponseEntity.ok(subscriptionService.listSubscriptions(BillingSecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "List my active subscriptions")
    @GetMapping("/my/active")
    public ResponseEntity<List<SubscriptionDto>> listMyActiveSubscriptions() {
        return ResponseEntity.ok(subscriptionService.listActiveSubscriptions(BillingSecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Get a subscription", description = "Owner or administrator only")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subscription found"),
            @ApiResponse(responseCode = "403", description = "Not the owner",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Subscription not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{subscriptionId}")
    public ResponseEntity<SubscriptionDto> getSubscription(
            @Parameter(description = "Subscription ID", required = true) @PathVariable UUID subscriptionId) {
        return ResponseEntity.ok(subscriptionService.getSubscription(subscriptionId, BillingSecurityUtils.currentRequester()));
    }

    @Operation(
            summary = "Cancel a subscription",
            description = "Cancels at the end of the current period unless 'immediately' is true."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Cancellation recorded"),
            @ApiResponse(responseCode = "403", description = "Not the owner",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Subscription is not active or already canceled",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Billing provider error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{subscriptionId}/cancel")
    public ResponseEntity<SubscriptionDto> cancelSubscription(
            @PathVariable UUID subscriptionId,
            @Valid @RequestBody(required = false) CancelSubscriptionRequest request) {
        boolean immediately = request != null && request.isImmediate();
        return ResponseEntity.ok(subscriptionService.cancelSubscription(
                subscriptionId, BillingSecurityUtils.currentRequester(), immediately));
    }

    @Operation(summary = "Reactivate a subscription", description = "Withdraws a pending period-end cancellation")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Subscription reactivated"),
            @ApiResponse(responseCode = "409", description = "Subscription is canceled or not pending cancellation",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{subscriptionId}/reactivate")
    public ResponseEntity<SubscriptionDto> reactivateSubscription(@PathVariable UUID subscriptionId) {
        return ResponseEntity.ok(subscriptionService.reactivateSubscription(
                subscriptionId, BillingSecurityUtils.currentRequester()));
    }

    @Operation(summary = "Open the billing portal", description = "Returns a provider-hosted portal URL for the caller")
    @PostMapping("/billing-portal")
    public ResponseEntity<BillingPortalResponse> openBillingPortal(
            @Valid @RequestBody(required = false) BillingPortalRequest request) {
        if (!featureFlags.isBilling()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        String returnUrl = request != null ? request.returnUrl() : null;
        return ResponseEntity.ok(subscriptionService.openBillingPortal(BillingSecurityUtils.getCurrentUserId(), returnUrl));
    }

    @Operation(summary = "Check access to a plan", description = "True iff the caller holds an ACTIVE subscription to the plan")
    @GetMapping("/access/{planId}")
    public ResponseEntity<EntitlementDto> checkAccess(@PathVariable UUID planId) {
        UUID subscriberId = BillingSecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(new EntitlementDto(subscriberId, planId, accessControlService.hasEntitlement(subscriberId, planId)));
    }

    @Operation(summary = "Get my access level", description = "PREMIUM when any subscription is ACTIVE, otherwise FREE")
    @GetMapping("/access-level")
    public ResponseEntity<AccessLevelDto> getAccessLevel() {
        UUID subscriberId = BillingSecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(new AccessLevelDto(subscriberId, accessControlService.accessLevel(subscriberId)));
    }

    @Operation(summary = "Creator subscription overview", description = "Counts, MRR, churn and ARPU across the caller's plans")
    @GetMapping("/stats/overview")
    @PreAuthorize("hasAnyRole('CREATOR', 'ADMIN')")
    public ResponseEntity<SubscriptionStatsDto> getOverview() {
        return ResponseEntity.ok(metricsService.summary(BillingSecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Plan statistics", description = "Active subscribers and monthly revenue of one plan")
    @GetMapping("/stats/plans/{planId}")
    @PreAuthorize("hasAnyRole('CREATOR', 'ADMIN')")
    public ResponseEntity<PlanStatsDto> getPlanStats(@PathVariable UUID planId) {
        return ResponseEntity.ok(metricsService.planStats(planId, BillingSecurityUtils.currentRequester()));
    }

    @Operation(summary = "Platform churn rate", description = "Percentage of subscriptions active at the window start that were canceled within it")
    @GetMapping("/stats/churn")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ChurnRateDto> getChurnRate(
            @Parameter(description = "Window length in days", example = "30")
            @RequestParam(defaultValue = "30") @Min(1) @Max(365) int windowDays) {
        return ResponseEntity.ok(new ChurnRateDto(windowDays, metricsService.churnRate(windowDays)));
    }
}
