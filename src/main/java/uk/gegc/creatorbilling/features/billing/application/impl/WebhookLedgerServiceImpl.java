package uk.gegc.creatorbilling.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creatorbilling.features.billing.application.WebhookLedgerService;
import uk.gegc.creatorbilling.features.billing.domain.model.BillingEvent;
import uk.gegc.creatorbilling.features.billing.domain.model.WebhookEvent;
import uk.gegc.creatorbilling.features.billing.domain.model.WebhookOutcome;
import uk.gegc.creatorbilling.features.billing.infra.repository.WebhookEventRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookLedgerServiceImpl implements WebhookLedgerService {

    private static final int MAX_REASON_LENGTH = 500;

    private final WebhookEventRepository webhookEventRepository;
    private final Clock clock;

    @Override
    @Transactional
    public boolean recordIfNew(BillingEvent event) {
        if (webhookEventRepository.existsById(event.externalEventId())) {
            return false;
        }
        webhookEventRepository.saveAndFlush(newEntry(event, null, null));
        return true;
    }

    @Override
    @Transactional
    public void finalizeOutcome(String externalEventId, WebhookOutcome outcome) {
        finalizeOutcome(externalEventId, outcome, null);
    }

    @Override
    @Transactional
    public void finalizeOutcome(String externalEventId, WebhookOutcome outcome, String reason) {
        int updated = webhookEventRepository.finalizeOutcome(externalEventId, outcome, truncate(reason));
        if (updated == 0) {
            log.warn("Ledger outcome for event {} already recorded or row missing; skipped {}", externalEventId, outcome);
        }
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordTerminalFailure(BillingEvent event, String reason) {
        if (webhookEventRepository.existsById(event.externalEventId())) {
            webhookEventRepository.finalizeOutcome(event.externalEventId(), WebhookOutcome.FAILED, truncate(reason));
            return;
        }
        webhookEventRepository.saveAndFlush(newEntry(event, WebhookOutcome.FAILED, truncate(reason)));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean contains(String externalEventId) {
        return webhookEventRepository.existsById(externalEventId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WebhookEvent> find(String externalEventId) {
        return webhookEventRepository.findById(externalEventId);
    }

    private WebhookEvent newEntry(BillingEvent event, WebhookOutcome outcome, String reason) {
        WebhookEvent entry = new WebhookEvent();
        entry.setExternalEventId(event.externalEventId());
        entry.setProvider(event.provider());
        entry.setEventType(event.rawType());
        entry.setSubscriptionExternalId(event.externalSubscriptionId());
        entry.setOccurredAt(event.occurredAt());
        entry.setReceivedAt(Instant.now(clock).truncatedTo(ChronoUnit.MICROS));
        entry.setProcessingOutcome(outcome);
        entry.setFailureReason(reason);
        return entry;
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_REASON_LENGTH);
    }
}
