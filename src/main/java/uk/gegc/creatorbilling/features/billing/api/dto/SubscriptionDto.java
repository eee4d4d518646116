package uk.gegc.creatorbilling.features.billing.api.dto;

import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionStatus;

import java.time.Instant;
import java.util.UUID;

public record SubscriptionDto(
        UUID id,
        UUID subscriberId,
        UUID planId,
        String externalSubscriptionId,
        SubscriptionStatus status,
        boolean cancelAtPeriodEnd,
        Instant currentPeriodStart,
        Instant currentPeriodEnd,
        Instant canceledAt,
        Instant lastEventAt,
        Instant createdAt,
        Instant updatedAt
) {}
