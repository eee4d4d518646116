package uk.gegc.creatorbilling.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creatorbilling.features.billing.domain.model.Subscription;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionStatus;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionTransition;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, UUID> {

    Optional<Subscription> findByExternalSubscriptionId(String externalSubscriptionId);

    Optional<Subscription> findByCheckoutReference(String checkoutReference);

    List<Subscription> findBySubscriberIdOrderByCreatedAtDesc(UUID subscriberId);

    List<Subscription> findBySubscriberIdAndStatusOrderByCreatedAtDesc(UUID subscriberId, SubscriptionStatus status);

    boolean existsBySubscriberIdAndPlanIdAndStatusIn(UUID subscriberId, UUID planId, Collection<SubscriptionStatus> statuses);

    boolean existsBySubscriberIdAndStatus(UUID subscriberId, SubscriptionStatus status);

    long countByPlanId(UUID planId);

    long countByPlanIdAndStatus(UUID planId, SubscriptionStatus status);

    /**
     * Guarded write of a full transition. Returns 0 when the row's status no longer matches
     * {@code expected} or the row already carries an event at or after {@code occurredAt}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Subscription s
        SET s.status = :target,
            s.externalSubscriptionId = :externalSubscriptionId,
            s.cancelAtPeriodEnd = :cancelAtPeriodEnd,
            s.currentPeriodStart = :periodStart,
            s.currentPeriodEnd = :periodEnd,
            s.activatedAt = :activatedAt,
            s.canceledAt = :canceledAt,
            s.entitlementKey = :entitlementKey,
            s.lastEventAt = :occurredAt,
            s.updatedAt = :updatedAt
        WHERE s.id = :id
          AND s.status = :expected
          AND (s.lastEventAt IS NULL OR s.lastEventAt < :occurredAt)
        """)
    int applyTransition(@Param("id") UUID id,
                        @Param("expected") SubscriptionStatus expected,
                        @Param("target") SubscriptionStatus target,
                        @Param("externalSubscriptionId") String externalSubscriptionId,
                        @Param("cancelAtPeriodEnd") boolean cancelAtPeriodEnd,
                        @Param("periodStart") Instant periodStart,
                        @Param("periodEnd") Instant periodEnd,
                        @Param("activatedAt") Instant activatedAt,
                        @Param("canceledAt") Instant canceledAt,
                        @Param("entitlementKey") String entitlementKey,
                        @Param("occurredAt") Instant occurredAt,
                        @Param("updatedAt") Instant updatedAt);

    default int applyTransition(SubscriptionTransition transition) {
        return applyTransition(
                transition.subscriptionId(),
                transition.expectedStatus(),
                transition.targetStatus(),
                transition.externalSubscriptionId(),
                transition.cancelAtPeriodEnd(),
                transition.currentPeriodStart(),
                transition.currentPeriodEnd(),
                transition.activatedAt(),
                transition.canceledAt(),
                transition.entitlementKey(),
                transition.occurredAt(),
                transition.updatedAt());
    }

    /**
     * Records the provider session on a pending row without touching its status, which a webhook may
     * already have moved.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Subscription s
        SET s.checkoutSessionId = :sessionId, s.updatedAt = :updatedAt
        WHERE s.id = :id
        """)
    int attachCheckoutSession(@Param("id") UUID id,
                              @Param("sessionId") String sessionId,
                              @Param("updatedAt") Instant updatedAt);

    // ==================== Metrics ====================

    @Query("""
        SELECT COUNT(s) FROM Subscription s
        WHERE s.status = :canceled
          AND s.canceledAt > :from AND s.canceledAt <= :to
        """)
    long countCanceledBetween(@Param("canceled") SubscriptionStatus canceled,
                              @Param("from") Instant from,
                              @Param("to") Instant to);

    @Query("""
        SELECT COUNT(s) FROM Subscription s
        WHERE s.activatedAt IS NOT NULL AND s.activatedAt <= :at
          AND (s.canceledAt IS NULL OR s.canceledAt > :at)
        """)
    long countActiveAt(@Param("at") Instant at);

    @Query("""
        SELECT COUNT(s) FROM Subscription s
        WHERE s.status = :canceled
          AND s.canceledAt > :from AND s.canceledAt <= :to
          AND s.planId IN (SELECT p.id FROM Plan p WHERE p.creatorId = :creatorId)
        """)
    long countCanceledBetweenForCreator(@Param("creatorId") UUID creatorId,
                                        @Param("canceled") SubscriptionStatus canceled,
                                        @Param("from") Instant from,
                                        @Param("to") Instant to);

    @Query("""
        SELECT COUNT(s) FROM Subscription s
        WHERE s.activatedAt IS NOT NULL AND s.activatedAt <= :at
          AND (s.canceledAt IS NULL OR s.canceledAt > :at)
          AND s.planId IN (SELECT p.id FROM Plan p WHERE p.creatorId = :creatorId)
        """)
    long countActiveAtForCreator(@Param("creatorId") UUID creatorId, @Param("at") Instant at);

    /**
     * One row per currency: {@code [currency, sum of price snapshots, distinct subscribers]}.
     */
    @Query("""
        SELECT s.currency, SUM(s.price), COUNT(DISTINCT s.subscriberId) FROM Subscription s
        WHERE s.status = :status
          AND s.planId IN (SELECT p.id FROM Plan p WHERE p.creatorId = :creatorId)
        GROUP BY s.currency
        """)
    List<Object[]> sumRevenueByCurrencyForCreator(@Param("creatorId") UUID creatorId,
                                                  @Param("status") SubscriptionStatus status);

    @Query("""
        SELECT s.currency, SUM(s.price) FROM Subscription s
        WHERE s.planId = :planId AND s.status = :status
        GROUP BY s.currency
        """)
    List<Object[]> sumRevenueByCurrencyForPlan(@Param("planId") UUID planId, @Param("status") SubscriptionStatus status);

    @Query("""
        SELECT s.status, COUNT(s) FROM Subscription s
        WHERE s.planId IN (SELECT p.id FROM Plan p WHERE p.creatorId = :creatorId)
        GROUP BY s.status
        """)
    List<Object[]> countByStatusForCreator(@Param("creatorId") UUID creatorId);
}
