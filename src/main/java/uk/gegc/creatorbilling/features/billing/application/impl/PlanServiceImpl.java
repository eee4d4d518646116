package uk.gegc.creatorbilling.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import uk.gegc.creatorbilling.features.billing.api.dto.CreatePlanRequest;
import uk.gegc.creatorbilling.features.billing.api.dto.PlanDto;
import uk.gegc.creatorbilling.features.billing.api.dto.UpdatePlanRequest;
import uk.gegc.creatorbilling.features.billing.application.BillingGateway;
import uk.gegc.creatorbilling.features.billing.application.PlanService;
import uk.gegc.creatorbilling.features.billing.application.RecurringPriceRequest;
import uk.gegc.creatorbilling.features.billing.application.Requester;
import uk.gegc.creatorbilling.features.billing.domain.exception.PlanInUseException;
import uk.gegc.creatorbilling.features.billing.domain.model.Plan;
import uk.gegc.creatorbilling.features.billing.infra.mapping.PlanMapper;
import uk.gegc.creatorbilling.features.billing.infra.repository.PlanRepository;
import uk.gegc.creatorbilling.features.billing.infra.repository.SubscriptionRepository;
import uk.gegc.creatorbilling.shared.exception.ForbiddenException;
import uk.gegc.creatorbilling.shared.exception.ResourceNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlanServiceImpl implements PlanService {

    private final PlanRepository planRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final BillingGateway billingGateway;
    private final PlanMapper planMapper;

    @Override
    @Transactional
    public PlanDto createPlan(UUID creatorId, CreatePlanRequest request) {
        Plan plan = new Plan();
        plan.setCreatorId(creatorId);
        plan.setName(request.name().trim());
        plan.setDescription(request.description().trim());
        plan.setPrice(request.price());
        plan.setCurrency(request.currency().toUpperCase(Locale.ROOT));
        plan.setFeatures(trimmed(request.features()));
        plan.setActive(true);
        Plan saved = planRepository.save(plan);

        if (StringUtils.hasText(request.externalPriceId())) {
            saved.setExternalPriceId(request.externalPriceId().trim());
        } else {
            saved.setExternalPriceId(provisionPrice(saved));
        }

        log.info("Creator {} created plan {} ({} {})", creatorId, saved.getId(), saved.getPrice(), saved.getCurrency());
        return planMapper.toDto(saved);
    }

    @Override
    @Transactional
    public PlanDto updatePlan(UUID planId, Requester requester, UpdatePlanRequest request) {
        Plan plan = loadOwned(planId, requester);

        boolean priceChanged = false;
        if (request.name() != null) {
            plan.setName(request.name().trim());
        }
        if (request.description() != null) {
            plan.setDescription(request.description().trim());
        }
        if (request.price() != null && request.price() != plan.getPrice()) {
            plan.setPrice(request.price());
            priceChanged = true;
        }
        if (request.currency() != null && !request.currency().equalsIgnoreCase(plan.getCurrency())) {
            plan.setCurrency(request.currency().toUpperCase(Locale.ROOT));
            priceChanged = true;
        }
        if (request.features() != null) {
            plan.setFeatures(trimmed(request.features()));
        }
        if (request.active() != null) {
            plan.setActive(request.active());
        }

        // Provider prices are immutable; existing subscriptions keep the old one.
        if (priceChanged) {
            plan.setExternalPriceId(provisionPrice(plan));
        }

        return planMapper.toDto(plan);
    }

    @Override
    @Transactional(readOnly = true)
    public PlanDto getPlan(UUID planId) {
        return planMapper.toDto(load(planId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<PlanDto> listActivePlans() {
        return planMapper.toDtos(planRepository.findByActiveTrueOrderByCreatedAtDesc());
    }

    @Override
    @Transactional(readOnly = true)
    public List<PlanDto> listPlansByCreator(UUID creatorId, boolean includeInactive) {
        List<Plan> plans = includeInactive
                ? planRepository.findByCreatorIdOrderByCreatedAtDesc(creatorId)
                : planRepository.findByCreatorIdAndActiveTrueOrderByCreatedAtDesc(creatorId);
        return planMapper.toDtos(plans);
    }

    @Override
    @Transactional
    public PlanDto deactivatePlan(UUID planId, Requester requester) {
        Plan plan = loadOwned(planId, requester);
        plan.setActive(false);
        log.info("Plan {} deactivated by {}", planId, requester.id());
        return planMapper.toDto(plan);
    }

    @Override
    @Transactional
    public void deletePlan(UUID planId, Requester requester) {
        Plan plan = loadOwned(planId, requester);
        long references = subscriptionRepository.countByPlanId(planId);
        if (references > 0) {
            throw new PlanInUseException(planId, references);
        }
        planRepository.delete(plan);
        log.info("Plan {} deleted by {}", planId, requester.id());
    }

    private Plan load(UUID planId) {
        return planRepository.findById(planId)
                .orElseThrow(() -> new ResourceNotFoundException("Plan " + planId + " not found"));
    }

    private Plan loadOwned(UUID planId, Requester requester) {
        Plan plan = load(planId);
        if (!requester.mayActOn(plan.getCreatorId())) {
            throw new ForbiddenException("You do not own plan " + planId);
        }
        return plan;
    }

    private String provisionPrice(Plan plan) {
        return billingGateway.createRecurringPrice(new RecurringPriceRequest(
                plan.getId(), plan.getName(), plan.getDescription(), plan.getPrice(), plan.getCurrency()));
    }

    private static List<String> trimmed(List<String> features) {
        List<String> result = new ArrayList<>(features.size());
        for (String feature : features) {
            result.add(feature.trim());
        }
        return result;
    }
}
