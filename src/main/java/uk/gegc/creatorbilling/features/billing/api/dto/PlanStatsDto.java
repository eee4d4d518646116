package uk.gegc.creatorbilling.features.billing.api.dto;

import java.util.Map;
import java.util.UUID;

public record PlanStatsDto(UUID planId, long subscriberCount, Map<String, Long> monthlyRevenue) {}
