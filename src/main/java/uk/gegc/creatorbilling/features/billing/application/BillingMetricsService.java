package uk.gegc.creatorbilling.features.billing.application;

import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionStatus;
import uk.gegc.creatorbilling.features.billing.domain.model.WebhookOutcome;

/**
 * Operational counters and timers for the billing pipeline.
 */
public interface BillingMetricsService {

    void incrementWebhookReceived(String provider, String eventType);

    void incrementWebhookOutcome(String provider, String eventType, WebhookOutcome outcome);

    void incrementWebhookRejected(String provider, String reason);

    void recordWebhookLatency(String provider, long latencyMs);

    void incrementSubscriptionTransition(SubscriptionStatus from, SubscriptionStatus to);

    void incrementCheckoutStarted();

    void incrementGatewayFailure(String operation, boolean retryable);
}
