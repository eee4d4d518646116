package uk.gegc.creatorbilling.features.billing.application;

import uk.gegc.creatorbilling.features.billing.api.dto.PlanStatsDto;
import uk.gegc.creatorbilling.features.billing.api.dto.SubscriptionStatsDto;

import java.util.Map;
import java.util.UUID;

/**
 * Business figures computed from committed subscription state. Amounts are minor currency units taken from
 * the price each subscription was sold at, and are never summed across currencies.
 */
public interface SubscriptionMetricsService {

    /**
     * Percentage of subscriptions active at the start of the window that were canceled within it.
     * Returns 0 when nothing was active at the window start.
     */
    double churnRate(int windowDays);

    double churnRate(UUID creatorId, int windowDays);

    /**
     * Sum of ACTIVE subscription prices, one entry per currency. Empty when nothing is active.
     */
    Map<String, Long> monthlyRecurringRevenue(UUID creatorId);

    /**
     * Per currency, that currency's MRR divided by its distinct active subscribers, rounded half up.
     */
    Map<String, Long> averageRevenuePerUser(UUID creatorId);

    SubscriptionStatsDto summary(UUID creatorId);

    /**
     * Active subscriber count and monthly revenue of one plan; only its creator or an administrator may read them.
     */
    PlanStatsDto planStats(UUID planId, Requester requester);
}
