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
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.creatorbilling.features.billing.api.dto.CreatePlanRequest;
import uk.gegc.creatorbilling.features.billing.api.dto.PlanDto;
import uk.gegc.creatorbilling.features.billing.api.dto.UpdatePlanRequest;
import uk.gegc.creatorbilling.features.billing.application.PlanService;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/plans")
@RequiredArgsConstructor
@Tag(name = "Plans", description = "Creator subscription plans")
public class PlanController {

    private final PlanService planService;

    @Operation(summary = "List active plans", description = "Public catalogue; optionally filtered by creator")
    @GetMapping
    public ResponseEntity<List<PlanDto>> listPlans(
            @Parameter(description = "Only plans of this creator") @RequestParam(required = false) UUID creatorId) {
        List<PlanDto> plans = creatorId != null
                ? planService.listPlansByCreator(creatorId, false)
                : planService.listActivePlans();
        return ResponseEntity.ok(plans);
    }

    @Operation(summary = "Get a plan")
    @GetMapping("/{planId}")
    public ResponseEntity<PlanDto> getPlan(@PathVariable UUID planId) {
        return ResponseEntity.ok(planService.getPlan(planId));
    }

    @Operation(summary = "List my plans", description = "All plans of the calling creator, including inactive ones")
    @SecurityRequirement(name = "Bearer Authentication")
    @GetMapping("/mine")
    @PreAuthorize("hasAnyRole('CREATOR', 'ADMIN')")
    public ResponseEntity<List<PlanDto>> listMyPlans() {
        return ResponseEntity.ok(planService.listPlansByCreator(BillingSecurityUtils.getCurrentUserId(), true));
    }

    @Operation(
            summary = "Create a plan",
            description = "Provisions a monthly provider price unless an existing one is supplied."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Plan created"),
            @ApiResponse(responseCode = "400", description = "Validation failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not a creator",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Billing provider error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @SecurityRequirement(name = "Bearer Authentication")
    @PostMapping
    @PreAuthorize("hasAnyRole('CREATOR', 'ADMIN')")
    public ResponseEntity<PlanDto> createPlan(@Valid @RequestBody CreatePlanRequest request) {
        PlanDto plan = planService.createPlan(BillingSecurityUtils.getCurrentUserId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(plan);
    }

    @Operation(summary = "Update a plan", description = "Owner or administrator only. A price change provisions a new provider price.")
    @SecurityRequirement(name = "Bearer Authentication")
    @PutMapping("/{planId}")
    @PreAuthorize("hasAnyRole('CREATOR', 'ADMIN')")
    public ResponseEntity<PlanDto> updatePlan(@PathVariable UUID planId, @Valid @RequestBody UpdatePlanRequest request) {
        return ResponseEntity.ok(planService.updatePlan(planId, BillingSecurityUtils.currentRequester(), request));
    }

    @Operation(summary = "Deactivate a plan", description = "Stops new checkouts; existing subscriptions are unaffected")
    @SecurityRequirement(name = "Bearer Authentication")
    @PostMapping("/{planId}/deactivate")
    @PreAuthorize("hasAnyRole('CREATOR', 'ADMIN')")
    public ResponseEntity<PlanDto> deactivatePlan(@PathVariable UUID planId) {
        return ResponseEntity.ok(planService.deactivatePlan(planId, BillingSecurityUtils.currentRequester()));
    }

    @Operation(summary = "Delete a plan", description = "Only possible while no subscription references the plan")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Plan deleted"),
            @ApiResponse(responseCode = "409", description = "Plan is referenced by subscriptions",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @SecurityRequirement(name = "Bearer Authentication")
    @DeleteMapping("/{planId}")
    @PreAuthorize("hasAnyRole('CREATOR', 'ADMIN')")
    public ResponseEntity<Void> deletePlan(@PathVariable UUID planId) {
        planService.deletePlan(planId, BillingSecurityUtils.currentRequester());
        return ResponseEntity.noContent().build();
    }
}
