package uk.gegc.creatorbilling.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creatorbilling.features.billing.api.dto.PlanStatsDto;
import uk.gegc.creatorbilling.features.billing.api.dto.SubscriptionStatsDto;
import uk.gegc.creatorbilling.features.billing.application.BillingProperties;
import uk.gegc.creatorbilling.features.billing.application.Requester;
import uk.gegc.creatorbilling.features.billing.application.SubscriptionMetricsService;
import uk.gegc.creatorbilling.features.billing.domain.model.Plan;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionStatus;
import uk.gegc.creatorbilling.features.billing.infra.repository.PlanRepository;
import uk.gegc.creatorbilling.features.billing.infra.repository.SubscriptionRepository;
import uk.gegc.creatorbilling.shared.exception.ForbiddenException;
import uk.gegc.creatorbilling.shared.exception.ResourceNotFoundException;
import uk.gegc.creatorbilling.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SubscriptionMetricsServiceImpl implements SubscriptionMetricsService {

    private final SubscriptionRepository subscriptionRepository;
    private final PlanRepository planRepository;
    private final BillingProperties billingProperties;
    private final Clock clock;

    @Override
    public double churnRate(int windowDays) {
        Instant end = clock.instant();
        Instant start = windowStart(end, windowDays);
        long activeAtStart = subscriptionRepository.countActiveAt(start);
        long canceled = subscriptionRepository.countCanceledBetween(SubscriptionStatus.CANCELED, start, end);
        return percentage(canceled, activeAtStart);
    }

    @Override
    public double churnRate(UUID creatorId, int windowDays) {
        Instant end = clock.instant();
        Instant start = windowStart(end, windowDays);
        long activeAtStart = subscriptionRepository.countActiveAtForCreator(creatorId, start);
        long canceled = subscriptionRepository.countCanceledBetweenForCreator(creatorId, SubscriptionStatus.CANCELED, start, end);
        return percentage(canceled, activeAtStart);
    }

    @Override
    public Map<String, Long> monthlyRecurringRevenue(UUID creatorId) {
        return sumsByCurrency(revenueRows(creatorId));
    }

    @Override
    public Map<String, Long> averageRevenuePerUser(UUID creatorId) {
        return averageRevenuePerUser(revenueRows(creatorId));
    }

    @Override
    public SubscriptionStatsDto summary(UUID creatorId) {
        Map<SubscriptionStatus, Long> counts = new EnumMap<>(SubscriptionStatus.class);
        List<Object[]> rows = subscriptionRepository.countByStatusForCreator(creatorId);
        for (Object[] row : rows) {
            counts.put((SubscriptionStatus) row[0], ((Number) row[1]).longValue());
        }
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        List<Object[]> revenue = revenueRows(creatorId);

        return new SubscriptionStatsDto(
                total,
                counts.getOrDefault(SubscriptionStatus.ACTIVE, 0L),
                counts.getOrDefault(SubscriptionStatus.PAST_DUE, 0L),
                counts.getOrDefault(SubscriptionStatus.CANCELED, 0L),
                sumsByCurrency(revenue),
                churnRate(creatorId, billingProperties.getChurnWindowDays()),
                averageRevenuePerUser(revenue));
    }

    @Override
    public PlanStatsDto planStats(UUID planId, Requester requester) {
        Plan plan = planRepository.findById(planId)
                .orElseThrow(() -> new ResourceNotFoundException("Plan " + planId + " not found"));
        if (!requester.mayActOn(plan.getCreatorId())) {
            throw new ForbiddenException("You do not own plan " + planId);
        }
        long active = subscriptionRepository.countByPlanIdAndStatus(planId, SubscriptionStatus.ACTIVE);
        Map<String, Long> revenue = sumsByCurrency(
                subscriptionRepository.sumRevenueByCurrencyForPlan(planId, SubscriptionStatus.ACTIVE));
        return new PlanStatsDto(planId, active, revenue);
    }

    private List<Object[]> revenueRows(UUID creatorId) {
        return subscriptionRepository.sumRevenueByCurrencyForCreator(creatorId, SubscriptionStatus.ACTIVE);
    }

    private static Map<String, Long> sumsByCurrency(List<Object[]> rows) {
        Map<String, Long> sums = new TreeMap<>();
        for (Object[] row : rows) {
            sums.put((String) row[0], ((Number) row[1]).longValue());
        }
        return sums;
    }

    // rows are [currency, price sum, distinct subscribers]
    private static Map<String, Long> averageRevenuePerUser(List<Object[]> revenueRows) {
        Map<String, Long> arpu = new TreeMap<>();
        for (Object[] row : revenueRows) {
            long sum = ((Number) row[1]).longValue();
            long subscribers = ((Number) row[2]).longValue();
            arpu.put((String) row[0], subscribers == 0 ? 0 : Math.round((double) sum / subscribers));
        }
        return arpu;
    }

    private static Instant windowStart(Instant end, int windowDays) {
        if (windowDays <= 0) {
            throw new ValidationException("Window must be at least one day");
        }
        return end.minus(Duration.ofDays(windowDays));
    }

    private static double percentage(long part, long whole) {
        if (whole == 0) {
            return 0.0;
        }
        return part * 100.0 / whole;
    }
}
