package uk.gegc.creatorbilling.features.billing.domain.exception;

/**
 * A provider event references a subscription this service has no row for (yet).
 * Surfaced as a non-2xx webhook response so the provider redelivers later.
 */
public class UnknownSubscriptionException extends RuntimeException {
    public UnknownSubscriptionException(String message) {
        super(message);
    }
}
