package uk.gegc.creatorbilling.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(name = "SubscriptionStatsDto", description = "Subscription totals and revenue for one creator")
public record SubscriptionStatsDto(
        long totalSubscriptions,
        long activeSubscriptions,
        long pastDueSubscriptions,
        long canceledSubscriptions,
        @Schema(description = "Monthly recurring revenue in minor units, keyed by ISO currency code",
                example = "{\"USD\": 4500}")
        Map<String, Long> monthlyRecurringRevenue,
        @Schema(description = "Churn over the configured window, as a percentage")
        double churnRate,
        @Schema(description = "Average revenue per active subscriber in minor units, keyed by ISO currency code")
        Map<String, Long> averageRevenuePerUser
) {}
