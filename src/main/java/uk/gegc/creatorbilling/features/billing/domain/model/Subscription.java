package uk.gegc.creatorbilling.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Local view of one subscriber's subscription to one plan.
 *
 * <p>Status changes are never written through this entity's setters once the row exists; they go through
 * the conditional update in {@code SubscriptionRepository#applyTransition} so that concurrent writers and
 * out-of-order provider events cannot overwrite a newer state.
 *
 * <p>{@code entitlementKey} is {@code subscriberId:planId} while the status holds the entitlement slot
 * (ACTIVE or PAST_DUE) and null otherwise; its unique index keeps at most one live subscription per pair.
 *
 * <p>{@code price} and {@code currency} are copied from the plan at checkout and never change afterwards;
 * revenue figures read them instead of the plan's current price.
 */
@Entity
@Table(name = "subscriptions")
@Getter
@Setter
@NoArgsConstructor
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "subscriber_id", nullable = false, updatable = false)
    private UUID subscriberId;

    @Column(name = "plan_id", nullable = false, updatable = false)
    private UUID planId;

    @Column(name = "external_subscription_id", unique = true, length = 255)
    private String externalSubscriptionId;

    @Column(name = "checkout_reference", nullable = false, unique = true, updatable = false, length = 64)
    private String checkoutReference;

    @Column(name = "price_cents", nullable = false, updatable = false)
    private long price;

    @Column(name = "currency", nullable = false, updatable = false, length = 3)
    private String currency;

    @Column(name = "checkout_session_id", length = 255)
    private String checkoutSessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SubscriptionStatus status = SubscriptionStatus.INCOMPLETE;

    @Column(name = "cancel_at_period_end", nullable = false)
    private boolean cancelAtPeriodEnd = false;

    @Column(name = "current_period_start")
    private Instant currentPeriodStart;

    @Column(name = "current_period_end")
    private Instant currentPeriodEnd;

    @Column(name = "activated_at")
    private Instant activatedAt;

    @Column(name = "canceled_at")
    private Instant canceledAt;

    @Column(name = "last_event_at")
    private Instant lastEventAt;

    @Column(name = "entitlement_key", unique = true, length = 80)
    private String entitlementKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public static String entitlementKeyFor(UUID subscriberId, UUID planId) {
        return subscriberId + ":" + planId;
    }

    public boolean isOwnedBy(UUID candidateSubscriberId) {
        return subscriberId != null && subscriberId.equals(candidateSubscriberId);
    }
}
