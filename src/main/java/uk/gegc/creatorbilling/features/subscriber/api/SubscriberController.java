package uk.gegc.creatorbilling.features.subscriber.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.creatorbilling.features.billing.api.BillingSecurityUtils;
import uk.gegc.creatorbilling.features.subscriber.api.dto.SubscriberDto;
import uk.gegc.creatorbilling.features.subscriber.api.dto.UpsertSubscriberRequest;
import uk.gegc.creatorbilling.features.subscriber.application.SubscriberService;

@RestController
@RequestMapping("/api/v1/subscribers")
@RequiredArgsConstructor
@Tag(name = "Subscribers", description = "Billing profile of the authenticated user")
@SecurityRequirement(name = "Bearer Authentication")
public class SubscriberController {

    private final SubscriberService subscriberService;

    @Operation(summary = "Register or update my billing profile")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Profile saved"),
            @ApiResponse(responseCode = "400", description = "Validation failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PutMapping("/me")
    public ResponseEntity<SubscriberDto> upsertProfile(@Valid @RequestBody UpsertSubscriberRequest request) {
        return ResponseEntity.ok(subscriberService.upsertProfile(BillingSecurityUtils.getCurrentUserId(), request));
    }

    @Operation(summary = "Get my billing profile")
    @GetMapping("/me")
    public ResponseEntity<SubscriberDto> getProfile() {
        return ResponseEntity.ok(subscriberService.getProfile(BillingSecurityUtils.getCurrentUserId()));
    }
}
