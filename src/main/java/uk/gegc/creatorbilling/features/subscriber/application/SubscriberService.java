package uk.gegc.creatorbilling.features.subscriber.application;

import uk.gegc.creatorbilling.features.subscriber.api.dto.SubscriberDto;
import uk.gegc.creatorbilling.features.subscriber.api.dto.UpsertSubscriberRequest;
import uk.gegc.creatorbilling.features.subscriber.domain.model.Subscriber;

import java.util.UUID;

public interface SubscriberService {

    SubscriberDto upsertProfile(UUID subscriberId, UpsertSubscriberRequest request);

    SubscriberDto getProfile(UUID subscriberId);

    /**
     * @throws uk.gegc.creatorbilling.shared.exception.ResourceNotFoundException if no profile is registered
     */
    Subscriber requireSubscriber(UUID subscriberId);

    void linkCustomerRef(UUID subscriberId, String customerRef);
}
