package uk.gegc.creatorbilling.features.subscriber.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creatorbilling.features.subscriber.api.dto.SubscriberDto;
import uk.gegc.creatorbilling.features.subscriber.api.dto.UpsertSubscriberRequest;
import uk.gegc.creatorbilling.features.subscriber.application.SubscriberService;
import uk.gegc.creatorbilling.features.subscriber.domain.model.Subscriber;
import uk.gegc.creatorbilling.features.subscriber.infra.mapping.SubscriberMapper;
import uk.gegc.creatorbilling.features.subscriber.infra.repository.SubscriberRepository;
import uk.gegc.creatorbilling.shared.exception.ResourceNotFoundException;

import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriberServiceImpl implements SubscriberService {

    private final SubscriberRepository subscriberRepository;
    private final SubscriberMapper subscriberMapper;

    @Override
    @Transactional
    public SubscriberDto upsertProfile(UUID subscriberId, UpsertSubscriberRequest request) {
        Subscriber subscriber = subscriberRepository.findById(subscriberId).orElseGet(() -> {
            Subscriber created = new Subscriber();
            created.setId(subscriberId);
            return created;
        });
        String email = request.email().trim().toLowerCase(Locale.ROOT);
        if (subscriber.getEmail() != null && !subscriber.getEmail().equals(email)) {
            // The provider customer is keyed by email; resolve it again on the next checkout
            subscriber.setExternalCustomerRef(null);
        }
        subscriber.setEmail(email);
        subscriber.setName(request.name().trim());
        Subscriber saved = subscriberRepository.save(subscriber);
        log.info("Upserted billing profile for subscriber {}", subscriberId);
        return subscriberMapper.toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public SubscriberDto getProfile(UUID subscriberId) {
        return subscriberMapper.toDto(requireSubscriber(subscriberId));
    }

    @Override
    @Transactional(readOnly = true)
    public Subscriber requireSubscriber(UUID subscriberId) {
        return subscriberRepository.findById(subscriberId)
                .orElseThrow(() -> new ResourceNotFoundException("Subscriber " + subscriberId + " not found"));
    }

    @Override
    @Transactional
    public void linkCustomerRef(UUID subscriberId, String customerRef) {
        Subscriber subscriber = requireSubscriber(subscriberId);
        if (!customerRef.equals(subscriber.getExternalCustomerRef())) {
            subscriber.setExternalCustomerRef(customerRef);
            subscriberRepository.save(subscriber);
        }
    }
}
