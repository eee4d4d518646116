package uk.gegc.creatorbilling.features.subscriber.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.creatorbilling.features.subscriber.api.dto.SubscriberDto;
import uk.gegc.creatorbilling.features.subscriber.domain.model.Subscriber;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface SubscriberMapper {

    @Mapping(target = "billingCustomerLinked", expression = "java(subscriber.getExternalCustomerRef() != null)")
    SubscriberDto toDto(Subscriber subscriber);
}
