package uk.gegc.creatorbilling.features.billing.application;

import uk.gegc.creatorbilling.features.billing.api.dto.CreatePlanRequest;
import uk.gegc.creatorbilling.features.billing.api.dto.PlanDto;
import uk.gegc.creatorbilling.features.billing.api.dto.UpdatePlanRequest;

import java.util.List;
import java.util.UUID;

public interface PlanService {

    /**
     * Creates a plan for the creator. When no provider price is supplied one is provisioned through the gateway.
     */
    PlanDto createPlan(UUID creatorId, CreatePlanRequest request);

    PlanDto updatePlan(UUID planId, Requester requester, UpdatePlanRequest request);

    PlanDto getPlan(UUID planId);

    List<PlanDto> listActivePlans();

    List<PlanDto> listPlansByCreator(UUID creatorId, boolean includeInactive);

    PlanDto deactivatePlan(UUID planId, Requester requester);

    /**
     * Hard delete, permitted only while no subscription references the plan.
     */
    void deletePlan(UUID planId, Requester requester);
}
