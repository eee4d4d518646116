package uk.gegc.creatorbilling.features.billing.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import uk.gegc.creatorbilling.features.billing.domain.exception.ExternalGatewayException;
import uk.gegc.creatorbilling.features.billing.domain.exception.InvalidSubscriptionStateException;
import uk.gegc.creatorbilling.features.billing.domain.exception.InvalidWebhookSignatureException;
import uk.gegc.creatorbilling.features.billing.domain.exception.PlanInUseException;
import uk.gegc.creatorbilling.features.billing.domain.exception.SubscriptionAlreadyCanceledException;
import uk.gegc.creatorbilling.features.billing.domain.exception.SubscriptionConflictException;
import uk.gegc.creatorbilling.features.billing.domain.exception.UnknownSubscriptionException;
import uk.gegc.creatorbilling.shared.api.problem.ErrorTypes;
import uk.gegc.creatorbilling.shared.api.problem.ProblemDetailBuilder;

/**
 * Error handler for billing API endpoints.
 * Maps billing domain exceptions to RFC 7807 Problem Detail responses; everything else falls through to the
 * global handler.
 */
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice(basePackages = "uk.gegc.creatorbilling.features.billing.api")
public class BillingErrorHandler {

    @ExceptionHandler(SubscriptionConflictException.class)
    public ResponseEntity<ProblemDetail> handleSubscriptionConflict(SubscriptionConflictException ex, HttpServletRequest request) {
        log.warn("Subscription conflict: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.SUBSCRIPTION_CONFLICT,
                "Subscription Conflict",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(InvalidSubscriptionStateException.class)
    public ResponseEntity<ProblemDetail> handleInvalidState(InvalidSubscriptionStateException ex, HttpServletRequest request) {
        log.warn("Invalid subscription state: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.INVALID_SUBSCRIPTION_STATE,
                "Invalid Subscription State",
                ex.getMessage(),
                request
        );
        if (ex.getCurrentStatus() != null) {
            problem.setProperty("currentStatus", ex.getCurrentStatus());
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(SubscriptionAlreadyCanceledException.class)
    public ResponseEntity<ProblemDetail> handleAlreadyCanceled(SubscriptionAlreadyCanceledException ex, HttpServletRequest request) {
        log.warn("Subscription already canceled: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.SUBSCRIPTION_ALREADY_CANCELED,
                "Subscription Already Canceled",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(PlanInUseException.class)
    public ResponseEntity<ProblemDetail> handlePlanInUse(PlanInUseException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.PLAN_IN_USE,
                "Plan In Use",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(InvalidWebhookSignatureException.class)
    public ResponseEntity<ProblemDetail> handleInvalidWebhookSignature(InvalidWebhookSignatureException ex, HttpServletRequest request) {
        log.warn("Invalid webhook signature: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.WEBHOOK_INVALID_SIGNATURE,
                "Webhook Invalid Signature",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(UnknownSubscriptionException.class)
    public ResponseEntity<ProblemDetail> handleUnknownSubscription(UnknownSubscriptionException ex, HttpServletRequest request) {
        // Not acknowledged, so the provider redelivers once the subscription exists locally
        log.error("Webhook processing failed: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.WEBHOOK_PROCESSING_ERROR,
                "Webhook Processing Error",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    @ExceptionHandler(ExternalGatewayException.class)
    public ResponseEntity<ProblemDetail> handleGatewayFailure(ExternalGatewayException ex, HttpServletRequest request) {
        log.error("Billing provider error: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_GATEWAY,
                ErrorTypes.BILLING_GATEWAY_ERROR,
                "Payment Processing Error",
                "The billing provider could not complete the request",
                request
        );
        problem.setProperty("retryable", ex.isRetryable());
        if (ex.getProviderCode() != null) {
            problem.setProperty("providerCode", ex.getProviderCode());
        }
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
    }
}
