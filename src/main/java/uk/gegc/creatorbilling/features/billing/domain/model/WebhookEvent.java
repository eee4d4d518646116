package uk.gegc.creatorbilling.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Ledger row for one provider-delivered notification. Inserted once per distinct event id;
 * only {@code processingOutcome} is written afterwards, and only while it is still null.
 */
@Entity
@Table(name = "webhook_events")
@Getter
@Setter
@NoArgsConstructor
public class WebhookEvent implements Persistable<String> {

    @Id
    @Column(name = "external_event_id", length = 255, nullable = false, updatable = false)
    private String externalEventId;

    @Column(name = "provider", length = 32, nullable = false, updatable = false)
    private String provider;

    @Column(name = "event_type", length = 100, nullable = false, updatable = false)
    private String eventType;

    @Column(name = "subscription_external_id", length = 255, updatable = false)
    private String subscriptionExternalId;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_outcome", length = 32)
    private WebhookOutcome processingOutcome;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Transient
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean fresh = true;

    @Override
    public String getId() {
        return externalEventId;
    }

    /**
     * Always persisted rather than merged, so a second insert of the same id hits the primary key.
     */
    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.fresh = false;
    }
}
