package uk.gegc.creatorbilling.features.billing.application;

import uk.gegc.creatorbilling.features.billing.domain.model.BillingEvent;
import uk.gegc.creatorbilling.features.billing.domain.model.WebhookEvent;
import uk.gegc.creatorbilling.features.billing.domain.model.WebhookOutcome;

import java.util.Optional;

/**
 * Append-only record of inbound provider events, keyed by the provider's event id.
 */
public interface WebhookLedgerService {

    /**
     * Inserts the ledger row for {@code event} in the caller's transaction.
     *
     * @return {@code true} if this call created the row, {@code false} if the id was already recorded
     * @throws org.springframework.dao.DataIntegrityViolationException when a concurrent delivery inserted the
     *         same id first; the surrounding transaction must roll back and the delivery counts as already seen
     */
    boolean recordIfNew(BillingEvent event);

    /**
     * Records the terminal outcome. A no-op when an outcome is already present.
     */
    void finalizeOutcome(String externalEventId, WebhookOutcome outcome);

    void finalizeOutcome(String externalEventId, WebhookOutcome outcome, String reason);

    /**
     * Writes a {@link WebhookOutcome#FAILED} row in its own transaction, for events whose processing
     * rolled back and can never succeed.
     */
    void recordTerminalFailure(BillingEvent event, String reason);

    boolean contains(String externalEventId);

    Optional<WebhookEvent> find(String externalEventId);
}
