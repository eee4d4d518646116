package uk.gegc.creatorbilling.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creatorbilling.features.billing.application.AccessControlService;
import uk.gegc.creatorbilling.features.billing.domain.model.AccessLevel;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionStatus;
import uk.gegc.creatorbilling.features.billing.infra.repository.SubscriptionRepository;

import java.util.EnumSet;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AccessControlServiceImpl implements AccessControlService {

    private final SubscriptionRepository subscriptionRepository;

    @Override
    public boolean hasEntitlement(UUID subscriberId, UUID planId) {
        return subscriptionRepository.existsBySubscriberIdAndPlanIdAndStatusIn(
                subscriberId, planId, EnumSet.of(SubscriptionStatus.ACTIVE));
    }

    @Override
    public AccessLevel accessLevel(UUID subscriberId) {
        return subscriptionRepository.existsBySubscriberIdAndStatus(subscriberId, SubscriptionStatus.ACTIVE)
                ? AccessLevel.PREMIUM
                : AccessLevel.FREE;
    }
}
