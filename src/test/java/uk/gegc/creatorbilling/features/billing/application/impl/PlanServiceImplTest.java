package uk.gegc.creatorbilling.features.billing.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.creatorbilling.features.billing.api.dto.CreatePlanRequest;
import uk.gegc.creatorbilling.features.billing.api.dto.UpdatePlanRequest;
import uk.gegc.creatorbilling.features.billing.application.BillingGateway;
import uk.gegc.creatorbilling.features.billing.application.RecurringPriceRequest;
import uk.gegc.creatorbilling.features.billing.application.Requester;
import uk.gegc.creatorbilling.features.billing.domain.exception.PlanInUseException;
import uk.gegc.creatorbilling.features.billing.domain.model.Plan;
import uk.gegc.creatorbilling.features.billing.infra.mapping.PlanMapper;
import uk.gegc.creatorbilling.features.billing.infra.repository.PlanRepository;
import uk.gegc.creatorbilling.features.billing.infra.repository.SubscriptionRepository;
import uk.gegc.creatorbilling.shared.exception.ForbiddenException;
import uk.gegc.creatorbilling.shared.exception.ResourceNotFoundException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PlanService")
class PlanServiceImplTest {

    @Mock
    private PlanRepository planRepository;
    @Mock
    private SubscriptionRepository subscriptionRepository;
    @Mock
    private BillingGateway billingGateway;
    @Mock
    private PlanMapper planMapper;

    @InjectMocks
    private PlanServiceImpl planService;

    private UUID creatorId;
    private Plan existing;

    @BeforeEach
    void setUp() {
        creatorId = UUID.randomUUID();
        existing = new Plan();
        existing.setId(UUID.randomUUID());
        existing.setCreatorId(creatorId);
        existing.setName("Supporter");
        existing.setDescription("Monthly posts");
        existing.setPrice(500);
        existing.setCurrency("USD");
        existing.setFeatures(List.of("Posts"));
        existing.setExternalPriceId("price_old");
    }

    @Test
    @DisplayName("createPlan normalizes input and provisions a provider price")
    void createProvisionsPrice() {
        // Given
        when(planRepository.save(any(Plan.class))).thenAnswer(inv -> {
            Plan p = inv.getArgument(0);
            p.setId(UUID.randomUUID());
            return p;
        });
        when(billingGateway.createRecurringPrice(any())).thenReturn("price_new");

        // When
        planService.createPlan(creatorId, new CreatePlanRequest(
                " Supporter ", "Monthly posts", 900L, "eur", List.of(" Posts ", "Chat"), null));

        // Then
        ArgumentCaptor<Plan> saved = ArgumentCaptor.forClass(Plan.class);
        verify(planRepository).save(saved.capture());
        Plan plan = saved.getValue();
        assertThat(plan.getName()).isEqualTo("Supporter");
        assertThat(plan.getCurrency()).isEqualTo("EUR");
        assertThat(plan.getFeatures()).containsExactly("Posts", "Chat");
        assertThat(plan.getExternalPriceId()).isEqualTo("price_new");

        ArgumentCaptor<RecurringPriceRequest> price = ArgumentCaptor.forClass(RecurringPriceRequest.class);
        verify(billingGateway).createRecurringPrice(price.capture());
        assertThat(price.getValue().amount()).isEqualTo(900L);
        assertThat(price.getValue().currency()).isEqualTo("EUR");
        assertThat(price.getValue().planId()).isEqualTo(plan.getId());
    }

    @Test
    @DisplayName("createPlan keeps a supplied provider price")
    void createWithExistingPrice() {
        // Given
        when(planRepository.save(any(Plan.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        planService.createPlan(creatorId, new CreatePlanRequest(
                "Supporter", "Monthly posts", 900L, "USD", List.of("Posts"), "price_existing"));

        // Then
        verify(billingGateway, never()).createRecurringPrice(any());
    }

    @Test
    @DisplayName("updatePlan provisions a new price only when the amount changes")
    void updatePriceChange() {
        // Given
        when(planRepository.findById(existing.getId())).thenReturn(Optional.of(existing));
        when(billingGateway.createRecurringPrice(any())).thenReturn("price_v2");

        // When
        planService.updatePlan(existing.getId(), Requester.subscriber(creatorId),
                new UpdatePlanRequest(null, null, 700L, null, null, null));

        // Then
        assertThat(existing.getPrice()).isEqualTo(700L);
        assertThat(existing.getExternalPriceId()).isEqualTo("price_v2");
    }

    @Test
    @DisplayName("updatePlan leaves the price alone for cosmetic changes")
    void updateCosmetic() {
        // Given
        when(planRepository.findById(existing.getId())).thenReturn(Optional.of(existing));

        // When
        planService.updatePlan(existing.getId(), Requester.subscriber(creatorId),
                new UpdatePlanRequest("Patron", null, 500L, "usd", null, null));

        // Then
        assertThat(existing.getName()).isEqualTo("Patron");
        assertThat(existing.getExternalPriceId()).isEqualTo("price_old");
        verify(billingGateway, never()).createRecurringPrice(any());
    }

    @Test
    @DisplayName("updatePlan refuses other creators")
    void updateForbidden() {
        // Given
        when(planRepository.findById(existing.getId())).thenReturn(Optional.of(existing));

        // When / Then
        assertThatThrownBy(() -> planService.updatePlan(existing.getId(), Requester.subscriber(UUID.randomUUID()),
                new UpdatePlanRequest("Patron", null, null, null, null, null)))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    @DisplayName("deactivatePlan hides the plan from new checkouts")
    void deactivate() {
        // Given
        when(planRepository.findById(existing.getId())).thenReturn(Optional.of(existing));

        // When
        planService.deactivatePlan(existing.getId(), Requester.administrator(UUID.randomUUID()));

        // Then
        assertThat(existing.isActive()).isFalse();
        assertThat(existing.isSubscribable()).isFalse();
    }

    @Test
    @DisplayName("deletePlan refuses plans with subscriptions")
    void deleteInUse() {
        // Given
        when(planRepository.findById(existing.getId())).thenReturn(Optional.of(existing));
        when(subscriptionRepository.countByPlanId(existing.getId())).thenReturn(2L);

        // When / Then
        assertThatThrownBy(() -> planService.deletePlan(existing.getId(), Requester.subscriber(creatorId)))
                .isInstanceOf(PlanInUseException.class);
        verify(planRepository, never()).delete(any());
    }

    @Test
    @DisplayName("deletePlan removes unused plans")
    void deleteUnused() {
        // Given
        when(planRepository.findById(existing.getId())).thenReturn(Optional.of(existing));
        when(subscriptionRepository.countByPlanId(existing.getId())).thenReturn(0L);

        // When
        planService.deletePlan(existing.getId(), Requester.subscriber(creatorId));

        // Then
        verify(planRepository).delete(existing);
    }

    @Test
    @DisplayName("getPlan reports unknown plans")
    void getUnknown() {
        UUID missing = UUID.randomUUID();
        when(planRepository.findById(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> planService.getPlan(missing)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("listPlansByCreator includes inactive plans only on request")
    void listByCreator() {
        // Given
        when(planRepository.findByCreatorIdOrderByCreatedAtDesc(creatorId)).thenReturn(List.of(existing));
        when(planMapper.toDtos(List.of(existing))).thenReturn(List.of());

        // When
        planService.listPlansByCreator(creatorId, true);

        // Then
        verify(planRepository, never()).findByCreatorIdAndActiveTrueOrderByCreatedAtDesc(any());
    }
}
