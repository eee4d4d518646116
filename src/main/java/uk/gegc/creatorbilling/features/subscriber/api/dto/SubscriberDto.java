package uk.gegc.creatorbilling.features.subscriber.api.dto;

import java.time.Instant;
import java.util.UUID;

public record SubscriberDto(
        UUID id,
        String email,
        String name,
        boolean billingCustomerLinked,
        Instant createdAt,
        Instant updatedAt
) {}
