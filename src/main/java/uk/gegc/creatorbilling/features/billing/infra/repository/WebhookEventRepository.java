package uk.gegc.creatorbilling.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.creatorbilling.features.billing.domain.model.WebhookEvent;
import uk.gegc.creatorbilling.features.billing.domain.model.WebhookOutcome;

@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEvent, String> {

    /**
     * Writes the terminal outcome once. Returns 0 if the outcome was already recorded.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE WebhookEvent e
        SET e.processingOutcome = :outcome, e.failureReason = :reason
        WHERE e.externalEventId = :eventId AND e.processingOutcome IS NULL
        """)
    int finalizeOutcome(@Param("eventId") String eventId,
                        @Param("outcome") WebhookOutcome outcome,
                        @Param("reason") String reason);

    long countByProcessingOutcome(WebhookOutcome outcome);
}
