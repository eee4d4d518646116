package uk.gegc.creatorbilling.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 * Each constant should point to documentation describing the error.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://creatorbilling.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== Subscription Errors ====================
    public static final URI SUBSCRIPTION_CONFLICT = URI.create(BASE_URL + "/subscription-conflict");
    public static final URI INVALID_SUBSCRIPTION_STATE = URI.create(BASE_URL + "/invalid-subscription-state");
    public static final URI SUBSCRIPTION_ALREADY_CANCELED = URI.create(BASE_URL + "/subscription-already-canceled");
    public static final URI PLAN_IN_USE = URI.create(BASE_URL + "/plan-in-use");

    // ==================== Billing Provider Errors ====================
    public static final URI WEBHOOK_INVALID_SIGNATURE = URI.create(BASE_URL + "/webhook-invalid-signature");
    public static final URI WEBHOOK_PROCESSING_ERROR = URI.create(BASE_URL + "/webhook-processing-error");
    public static final URI BILLING_GATEWAY_ERROR = URI.create(BASE_URL + "/billing-gateway-error");

    // ==================== Generic Errors ====================
    public static final URI DATA_CONFLICT = URI.create(BASE_URL + "/data-conflict");
    public static final URI CONCURRENT_UPDATE = URI.create(BASE_URL + "/concurrent-update");
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
