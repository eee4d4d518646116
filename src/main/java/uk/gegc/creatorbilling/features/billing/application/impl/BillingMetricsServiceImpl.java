package uk.gegc.creatorbilling.features.billing.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.creatorbilling.features.billing.application.BillingMetricsService;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionStatus;
import uk.gegc.creatorbilling.features.billing.domain.model.WebhookOutcome;

import java.util.concurrent.TimeUnit;

/**
 * Emits billing metrics through Micrometer. Every metric is mirrored as a {@code METRIC:} log line.
 */
@Slf4j
@Service
public class BillingMetricsServiceImpl implements BillingMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter checkoutStartedCounter;

    public BillingMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.checkoutStartedCounter = Counter.builder("billing.checkout.started")
                .description("Number of checkout sessions started")
                .register(meterRegistry);
    }

    @Override
    public void incrementWebhookReceived(String provider, String eventType) {
        log.info("METRIC: billing.webhooks.received provider={} eventType={}", provider, eventType);
        Counter.builder("billing.webhooks.received")
                .description("Number of billing provider webhooks received")
                .tag("provider", provider)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementWebhookOutcome(String provider, String eventType, WebhookOutcome outcome) {
        log.info("METRIC: billing.webhooks.outcome provider={} eventType={} outcome={}", provider, eventType, outcome);
        Counter.builder("billing.webhooks.outcome")
                .description("Webhook processing outcomes")
                .tag("provider", provider)
                .tag("outcome", outcome.name().toLowerCase())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementWebhookRejected(String provider, String reason) {
        log.warn("METRIC: billing.webhooks.rejected provider={} reason={}", provider, reason);
        Counter.builder("billing.webhooks.rejected")
                .description("Webhooks rejected before reaching the ledger")
                .tag("provider", provider)
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordWebhookLatency(String provider, long latencyMs) {
        log.info("METRIC: billing.webhooks.latency provider={} latencyMs={}", provider, latencyMs);
        Timer.builder("billing.webhooks.latency")
                .description("Webhook processing latency")
                .tag("provider", provider)
                .register(meterRegistry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void incrementSubscriptionTransition(SubscriptionStatus from, SubscriptionStatus to) {
        log.info("METRIC: billing.subscriptions.transitions from={} to={}", from, to);
        Counter.builder("billing.subscriptions.transitions")
                .description("Applied subscription state transitions")
                .tag("from", from.name().toLowerCase())
                .tag("to", to.name().toLowerCase())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementCheckoutStarted() {
        log.info("METRIC: billing.checkout.started");
        checkoutStartedCounter.increment();
    }

    @Override
    public void incrementGatewayFailure(String operation, boolean retryable) {
        log.warn("METRIC: billing.gateway.failures operation={} retryable={}", operation, retryable);
        Counter.builder("billing.gateway.failures")
                .description("Failed calls to the billing provider")
                .tag("operation", operation)
                .tag("retryable", String.valueOf(retryable))
                .register(meterRegistry)
                .increment();
    }
}
