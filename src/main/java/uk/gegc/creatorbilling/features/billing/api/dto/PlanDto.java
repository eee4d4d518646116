package uk.gegc.creatorbilling.features.billing.api.dto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record PlanDto(
        UUID id,
        UUID creatorId,
        String name,
        String description,
        long price,
        String currency,
        List<String> features,
        boolean active,
        String externalPriceId,
        Instant createdAt,
        Instant updatedAt
) {}
