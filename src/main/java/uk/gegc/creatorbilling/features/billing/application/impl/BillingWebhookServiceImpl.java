package uk.gegc.creatorbilling.features.billing.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import uk.gegc.creatorbilling.features.billing.application.BillingMetricsService;
import uk.gegc.creatorbilling.features.billing.application.BillingWebhookService;
import uk.gegc.creatorbilling.features.billing.application.ReconciliationService;
import uk.gegc.creatorbilling.features.billing.application.WebhookEventReader;
import uk.gegc.creatorbilling.features.billing.application.WebhookLedgerService;
import uk.gegc.creatorbilling.features.billing.application.WebhookLoggingContext;
import uk.gegc.creatorbilling.features.billing.domain.exception.EntitlementConflictException;
import uk.gegc.creatorbilling.features.billing.domain.exception.InvalidWebhookSignatureException;
import uk.gegc.creatorbilling.features.billing.domain.model.BillingEvent;
import uk.gegc.creatorbilling.features.billing.domain.model.WebhookOutcome;
import uk.gegc.creatorbilling.shared.exception.ValidationException;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class BillingWebhookServiceImpl implements BillingWebhookService {

    private final Map<String, WebhookEventReader> readers;
    private final ReconciliationService reconciliationService;
    private final WebhookLedgerService ledgerService;
    private final BillingMetricsService metricsService;

    public BillingWebhookServiceImpl(List<WebhookEventReader> readers,
                                     ReconciliationService reconciliationService,
                                     WebhookLedgerService ledgerService,
                                     BillingMetricsService metricsService) {
        this.readers = readers.stream()
                .collect(Collectors.toUnmodifiableMap(WebhookEventReader::provider, Function.identity()));
        this.reconciliationService = reconciliationService;
        this.ledgerService = ledgerService;
        this.metricsService = metricsService;
    }

    @Override
    public WebhookOutcome process(String provider, String payload, String signatureHeader) {
        long startTime = System.currentTimeMillis();

        WebhookEventReader reader = readers.get(provider);
        if (reader == null) {
            throw new IllegalArgumentException("No webhook reader registered for provider " + provider);
        }

        final BillingEvent event;
        try {
            event = reader.read(payload, signatureHeader);
        } catch (InvalidWebhookSignatureException e) {
            metricsService.incrementWebhookRejected(provider, "signature");
            throw e;
        } catch (ValidationException e) {
            metricsService.incrementWebhookRejected(provider, "payload");
            throw e;
        }

        metricsService.incrementWebhookReceived(provider, event.rawType());

        WebhookLoggingContext loggingContext = WebhookLoggingContext.builder()
                .eventId(event.externalEventId())
                .eventType(event.rawType())
                .provider(provider)
                .subscriptionId(event.externalSubscriptionId())
                .build();

        loggingContext.logInfo(log, "Processing billing webhook event: id={} type={} occurredAt={}",
                event.externalEventId(), event.rawType(), event.occurredAt());

        try {
            WebhookOutcome outcome = reconcile(event, loggingContext);
            metricsService.incrementWebhookOutcome(provider, event.rawType(), outcome);
            loggingContext.logInfo(log, "Billing webhook event id={} finished with outcome {}", event.externalEventId(), outcome);
            return outcome;
        } catch (RuntimeException e) {
            metricsService.incrementWebhookOutcome(provider, event.rawType(), WebhookOutcome.FAILED);
            loggingContext.logError(log, "Failed to process webhook event: id={} type={}",
                    event.externalEventId(), event.rawType(), e);
            throw e; // Re-throw so the controller returns 500 and the provider retries
        } finally {
            metricsService.recordWebhookLatency(provider, System.currentTimeMillis() - startTime);
            WebhookLoggingContext.clearMDC();
        }
    }

    private WebhookOutcome reconcile(BillingEvent event, WebhookLoggingContext loggingContext) {
        try {
            return reconciliationService.applyEvent(event);
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            // A concurrent delivery of the same event id committed its ledger row first
            if (ledgerService.contains(event.externalEventId())) {
                loggingContext.logInfo(log, "Concurrent duplicate delivery of event id={}", event.externalEventId());
                return WebhookOutcome.IGNORED_DUPLICATE;
            }
            throw e;
        } catch (EntitlementConflictException e) {
            loggingContext.logWarn(log, "Event id={} cannot be applied: {}", event.externalEventId(), e.getMessage());
            ledgerService.recordTerminalFailure(event, e.getMessage());
            return WebhookOutcome.FAILED;
        }
    }
}
