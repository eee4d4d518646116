package uk.gegc.creatorbilling.features.billing.application;

import uk.gegc.creatorbilling.features.billing.domain.model.BillingEvent;

/**
 * Verifies and decodes one provider's webhook deliveries.
 */
public interface WebhookEventReader {

    String provider();

    /**
     * @throws uk.gegc.creatorbilling.features.billing.domain.exception.InvalidWebhookSignatureException if the
     *         signature is missing or does not match the raw payload
     * @throws uk.gegc.creatorbilling.shared.exception.ValidationException if the signed payload is malformed
     */
    BillingEvent read(String payload, String signatureHeader);
}
