package uk.gegc.creatorbilling.features.billing.api.dto;

import java.util.UUID;

public record EntitlementDto(UUID subscriberId, UUID planId, boolean hasAccess) {}
