package uk.gegc.creatorbilling.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.creatorbilling.features.billing.api.dto.PlanDto;
import uk.gegc.creatorbilling.features.billing.domain.model.Plan;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface PlanMapper {

    PlanDto toDto(Plan plan);

    List<PlanDto> toDtos(List<Plan> plans);
}
