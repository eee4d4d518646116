package uk.gegc.creatorbilling.features.billing.domain.exception;

/**
 * The billing provider was unreachable or rejected a call.
 * {@code retryable} separates transient failures (connection, 5xx, rate limit) from request errors.
 */
public class ExternalGatewayException extends RuntimeException {

    private final boolean retryable;
    private final String providerCode;

    public ExternalGatewayException(String message, boolean retryable) {
        this(message, retryable, null, null);
    }

    public ExternalGatewayException(String message, boolean retryable, String providerCode, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
        this.providerCode = providerCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String getProviderCode() {
        return providerCode;
    }
}
