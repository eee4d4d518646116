package uk.gegc.creatorbilling.features.billing.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.creatorbilling.features.billing.api.dto.SubscriptionDto;
import uk.gegc.creatorbilling.features.billing.domain.model.Subscription;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface SubscriptionMapper {

    SubscriptionDto toDto(Subscription subscription);

    List<SubscriptionDto> toDtos(List<Subscription> subscriptions);
}
