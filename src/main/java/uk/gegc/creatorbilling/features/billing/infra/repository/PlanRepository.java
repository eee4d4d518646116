package uk.gegc.creatorbilling.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.creatorbilling.features.billing.domain.model.Plan;

import java.util.List;
import java.util.UUID;

@Repository
public interface PlanRepository extends JpaRepository<Plan, UUID> {

    List<Plan> findByActiveTrueOrderByCreatedAtDesc();

    List<Plan> findByCreatorIdAndActiveTrueOrderByCreatedAtDesc(UUID creatorId);

    List<Plan> findByCreatorIdOrderByCreatedAtDesc(UUID creatorId);
}
