package uk.gegc.creatorbilling.features.subscriber.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.creatorbilling.features.subscriber.api.dto.UpsertSubscriberRequest;
import uk.gegc.creatorbilling.features.subscriber.domain.model.Subscriber;
import uk.gegc.creatorbilling.features.subscriber.infra.mapping.SubscriberMapper;
import uk.gegc.creatorbilling.features.subscriber.infra.repository.SubscriberRepository;
import uk.gegc.creatorbilling.shared.exception.ResourceNotFoundException;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SubscriberServiceImpl")
class SubscriberServiceImplTest {

    @Mock
    private SubscriberRepository subscriberRepository;

    @Mock
    private SubscriberMapper subscriberMapper;

    @InjectMocks
    private SubscriberServiceImpl subscriberService;

    @Nested
    @DisplayName("upsertProfile")
    class UpsertProfile {

        @Test
        @DisplayName("creates a profile with a normalized email")
        void createsProfile() {
            // Given
            UUID subscriberId = UUID.randomUUID();
            when(subscriberRepository.findById(subscriberId)).thenReturn(Optional.empty());
            when(subscriberRepository.save(any(Subscriber.class))).thenAnswer(inv -> inv.getArgument(0));

            // When
            subscriberService.upsertProfile(subscriberId, new UpsertSubscriberRequest("  Reader@Example.COM ", " Ada "));

            // Then
            ArgumentCaptor<Subscriber> saved = ArgumentCaptor.forClass(Subscriber.class);
            verify(subscriberRepository).save(saved.capture());
            assertThat(saved.getValue().getId()).isEqualTo(subscriberId);
            assertThat(saved.getValue().getEmail()).isEqualTo("reader@example.com");
            assertThat(saved.getValue().getName()).isEqualTo("Ada");
        }

        @Test
        @DisplayName("unlinks the provider customer when the email changes")
        void emailChangeUnlinksCustomer() {
            // Given
            Subscriber existing = subscriber("old@example.com", "cus_1");
            when(subscriberRepository.findById(existing.getId())).thenReturn(Optional.of(existing));
            when(subscriberRepository.save(any(Subscriber.class))).thenAnswer(inv -> inv.getArgument(0));

            // When
            subscriberService.upsertProfile(existing.getId(), new UpsertSubscriberRequest("new@example.com", "Ada"));

            // Then
            assertThat(existing.getExternalCustomerRef()).isNull();
            assertThat(existing.getEmail()).isEqualTo("new@example.com");
        }

        @Test
        @DisplayName("keeps the provider customer when only the name changes")
        void nameChangeKeepsCustomer() {
            // Given
            Subscriber existing = subscriber("reader@example.com", "cus_1");
            when(subscriberRepository.findById(existing.getId())).thenReturn(Optional.of(existing));
            when(subscriberRepository.save(any(Subscriber.class))).thenAnswer(inv -> inv.getArgument(0));

            // When
            subscriberService.upsertProfile(existing.getId(), new UpsertSubscriberRequest("reader@example.com", "Ada Lovelace"));

            // Then
            assertThat(existing.getExternalCustomerRef()).isEqualTo("cus_1");
            assertThat(existing.getName()).isEqualTo("Ada Lovelace");
        }
    }

    @Nested
    @DisplayName("Customer linking")
    class CustomerLinking {

        @Test
        @DisplayName("stores a new customer reference")
        void linksCustomer() {
            Subscriber existing = subscriber("reader@example.com", null);
            when(subscriberRepository.findById(existing.getId())).thenReturn(Optional.of(existing));

            subscriberService.linkCustomerRef(existing.getId(), "cus_9");

            assertThat(existing.getExternalCustomerRef()).isEqualTo("cus_9");
            verify(subscriberRepository).save(existing);
        }

        @Test
        @DisplayName("skips the write when the reference is unchanged")
        void unchangedReference() {
            Subscriber existing = subscriber("reader@example.com", "cus_9");
            when(subscriberRepository.findById(existing.getId())).thenReturn(Optional.of(existing));

            subscriberService.linkCustomerRef(existing.getId(), "cus_9");

            verify(subscriberRepository, never()).save(any());
        }

        @Test
        @DisplayName("requires a registered profile")
        void unknownSubscriber() {
            UUID subscriberId = UUID.randomUUID();
            when(subscriberRepository.findById(subscriberId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> subscriberService.requireSubscriber(subscriberId))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessageContaining(subscriberId.toString());
        }
    }

    private static Subscriber subscriber(String email, String customerRef) {
        Subscriber subscriber = new Subscriber();
        subscriber.setId(UUID.randomUUID());
        subscriber.setEmail(email);
        subscriber.setName("Ada");
        subscriber.setExternalCustomerRef(customerRef);
        return subscriber;
    }
}
