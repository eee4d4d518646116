package uk.gegc.creatorbilling.features.billing.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.creatorbilling.features.billing.domain.model.AccessLevel;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionStatus;
import uk.gegc.creatorbilling.features.billing.infra.repository.SubscriptionRepository;

import java.util.EnumSet;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Access control")
class AccessControlServiceImplTest {

    @Mock
    private SubscriptionRepository subscriptionRepository;

    @InjectMocks
    private AccessControlServiceImpl accessControlService;

    private final UUID subscriberId = UUID.randomUUID();
    private final UUID planId = UUID.randomUUID();

    @Test
    @DisplayName("grants a plan only while a subscription to it is ACTIVE")
    void entitlementRequiresActive() {
        // Given
        when(subscriptionRepository.existsBySubscriberIdAndPlanIdAndStatusIn(
                subscriberId, planId, EnumSet.of(SubscriptionStatus.ACTIVE))).thenReturn(true);

        // Then
        assertThat(accessControlService.hasEntitlement(subscriberId, planId)).isTrue();
    }

    @Test
    @DisplayName("denies a plan whose subscription is past due or canceled")
    void noEntitlementOtherwise() {
        // Given
        when(subscriptionRepository.existsBySubscriberIdAndPlanIdAndStatusIn(
                subscriberId, planId, EnumSet.of(SubscriptionStatus.ACTIVE))).thenReturn(false);

        // Then
        assertThat(accessControlService.hasEntitlement(subscriberId, planId)).isFalse();
    }

    @Test
    @DisplayName("reports PREMIUM when any subscription is ACTIVE")
    void premium() {
        when(subscriptionRepository.existsBySubscriberIdAndStatus(subscriberId, SubscriptionStatus.ACTIVE)).thenReturn(true);

        assertThat(accessControlService.accessLevel(subscriberId)).isEqualTo(AccessLevel.PREMIUM);
    }

    @Test
    @DisplayName("reports FREE otherwise")
    void free() {
        when(subscriptionRepository.existsBySubscriberIdAndStatus(subscriberId, SubscriptionStatus.ACTIVE)).thenReturn(false);

        assertThat(accessControlService.accessLevel(subscriberId)).isEqualTo(AccessLevel.FREE);
    }
}
