package uk.gegc.creatorbilling.features.billing.application;

import uk.gegc.creatorbilling.features.billing.domain.model.WebhookOutcome;

/**
 * Entry point for signed provider webhooks.
 */
public interface BillingWebhookService {

    /**
     * Verifies, records and reconciles one delivery.
     *
     * <p>Every returned outcome is acknowledged with a success response. Exceptions mean the delivery must
     * not be acknowledged: signature and payload errors are rejected outright, anything else is a processing
     * failure the provider should retry.
     *
     * @param provider name of the {@link WebhookEventReader} that owns the endpoint
     */
    WebhookOutcome process(String provider, String payload, String signatureHeader);
}
