package uk.gegc.creatorbilling.features.billing.application.impl;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;
import uk.gegc.creatorbilling.features.billing.api.dto.SubscriptionDto;
import uk.gegc.creatorbilling.features.billing.application.BillingGateway;
import uk.gegc.creatorbilling.features.billing.application.BillingWebhookService;
import uk.gegc.creatorbilling.features.billing.application.ReconciliationService;
import uk.gegc.creatorbilling.features.billing.application.Requester;
import uk.gegc.creatorbilling.features.billing.application.SubscriptionService;
import uk.gegc.creatorbilling.features.billing.domain.event.SubscriptionTransitionedEvent;
import uk.gegc.creatorbilling.features.billing.domain.exception.UnknownSubscriptionException;
import uk.gegc.creatorbilling.features.billing.domain.model.BillingEvent;
import uk.gegc.creatorbilling.features.billing.domain.model.BillingEventType;
import uk.gegc.creatorbilling.features.billing.domain.model.Subscription;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionStatus;
import uk.gegc.creatorbilling.features.billing.domain.model.WebhookEvent;
import uk.gegc.creatorbilling.features.billing.domain.model.WebhookOutcome;
import uk.gegc.creatorbilling.features.billing.infra.repository.SubscriptionRepository;
import uk.gegc.creatorbilling.features.billing.infra.repository.WebhookEventRepository;
import uk.gegc.creatorbilling.features.billing.infra.webhook.HmacSignatureVerifier;
import uk.gegc.creatorbilling.features.billing.infra.webhook.SignedEnvelopeEventReader;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

/**
 * Runs provider events and user actions through the real reconciliation engine against the
 * in-memory database, so the guarded update, the ledger uniqueness and the entitlement index all take part.
 */
@SpringBootTest
@ActiveProfiles("test")
@RecordApplicationEvents
@DisplayName("Reconciliation engine integration")
class ReconciliationServiceIntegrationTest {

    private static final String SIGNING_SECRET = "test-envelope-secret";

    private static final Instant T1 = Instant.parse("2025-03-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2025-04-01T10:00:00Z");
    private static final Instant T2_5 = Instant.parse("2025-04-10T10:00:00Z");
    private static final Instant T3 = Instant.parse("2025-04-20T10:00:00Z");
    private static final Instant T4 = Instant.parse("2025-05-01T10:00:00Z");

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private BillingWebhookService webhookService;

    @Autowired
    private SubscriptionService subscriptionService;

    @Autowired
    private SubscriptionRepository subscriptionRepository;

    @Autowired
    private WebhookEventRepository webhookEventRepository;

    @Autowired
    private HmacSignatureVerifier signatureVerifier;

    @Autowired
    private ApplicationEvents applicationEvents;

    @MockitoBean
    private BillingGateway billingGateway;

    private UUID subscriberId;
    private UUID planId;
    private Subscription subscription;

    @BeforeEach
    void setUp() {
        subscriberId = UUID.randomUUID();
        planId = UUID.randomUUID();
        subscription = newIncomplete(subscriberId, planId);
    }

    @AfterEach
    void tearDown() {
        subscriptionRepository.deleteAll();
        webhookEventRepository.deleteAll();
    }

    @Nested
    @DisplayName("Lifecycle scenarios")
    class LifecycleScenarios {

        @Test
        @DisplayName("Checkout completion activates the subscription and stamps the event time")
        void checkoutCompletedActivates() {
            // When
            WebhookOutcome outcome = reconciliationService.applyEvent(checkoutCompleted("evt_a", T1));

            // Then
            assertThat(outcome).isEqualTo(WebhookOutcome.APPLIED);
            Subscription stored = reload();
            assertThat(stored.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(stored.getLastEventAt()).isEqualTo(T1);
            assertThat(stored.getActivatedAt()).isEqualTo(T1);
            assertThat(stored.getExternalSubscriptionId()).isEqualTo("sub_" + subscription.getId());
            assertThat(stored.getEntitlementKey()).isEqualTo(Subscription.entitlementKeyFor(subscriberId, planId));
            assertThat(ledgerOutcome("evt_a")).isEqualTo(WebhookOutcome.APPLIED);
            assertThat(applicationEvents.stream(SubscriptionTransitionedEvent.class)
                    .filter(e -> e.getSubscriptionId().equals(subscription.getId())))
                    .singleElement()
                    .satisfies(e -> {
                        assertThat(e.getFromStatus()).isEqualTo(SubscriptionStatus.INCOMPLETE);
                        assertThat(e.getToStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
                    });
        }

        @Test
        @DisplayName("Payment failure then recovery moves ACTIVE to PAST_DUE and back")
        void paymentFailureAndRecovery() {
            // Given
            reconciliationService.applyEvent(checkoutCompleted("evt_a", T1));

            // When
            WebhookOutcome failed = reconciliationService.applyEvent(event("evt_b1", BillingEventType.PAYMENT_FAILED, T2, null));
            SubscriptionStatus afterFailure = reload().getStatus();
            WebhookOutcome recovered = reconciliationService.applyEvent(event("evt_b2", BillingEventType.PAYMENT_SUCCEEDED, T3, null));

            // Then
            assertThat(failed).isEqualTo(WebhookOutcome.APPLIED);
            assertThat(afterFailure).isEqualTo(SubscriptionStatus.PAST_DUE);
            assertThat(recovered).isEqualTo(WebhookOutcome.APPLIED);
            Subscription stored = reload();
            assertThat(stored.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(stored.getLastEventAt()).isEqualTo(T3);
            assertThat(stored.getEntitlementKey()).isNotNull();
        }

        @Test
        @DisplayName("Provider deletion is terminal and a redelivery is reported as a duplicate")
        void deletionIsTerminal() {
            // Given
            reconciliationService.applyEvent(checkoutCompleted("evt_a", T1));
            BillingEvent deleted = event("evt_c", BillingEventType.SUBSCRIPTION_DELETED, T4, SubscriptionStatus.CANCELED);

            // When
            WebhookOutcome first = reconciliationService.applyEvent(deleted);
            WebhookOutcome redelivery = reconciliationService.applyEvent(deleted);

            // Then
            assertThat(first).isEqualTo(WebhookOutcome.APPLIED);
            assertThat(redelivery).isEqualTo(WebhookOutcome.IGNORED_DUPLICATE);
            Subscription stored = reload();
            assertThat(stored.getStatus()).isEqualTo(SubscriptionStatus.CANCELED);
            assertThat(stored.getCanceledAt()).isEqualTo(T4);
            assertThat(stored.getEntitlementKey()).isNull();
            assertThat(webhookEventRepository.count()).isEqualTo(2);
        }

        @Test
        @DisplayName("An update older than the last applied event is ignored as stale")
        void lateUpdateIsStale() {
            // Given
            reconciliationService.applyEvent(checkoutCompleted("evt_a", T1));
            reconciliationService.applyEvent(event("evt_b1", BillingEventType.PAYMENT_FAILED, T2, null));
            reconciliationService.applyEvent(event("evt_b2", BillingEventType.PAYMENT_SUCCEEDED, T3, null));

            // When
            WebhookOutcome outcome = reconciliationService.applyEvent(
                    event("evt_d", BillingEventType.SUBSCRIPTION_UPDATED, T2_5, SubscriptionStatus.ACTIVE));

            // Then
            assertThat(outcome).isEqualTo(WebhookOutcome.IGNORED_STALE);
            Subscription stored = reload();
            assertThat(stored.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(stored.getLastEventAt()).isEqualTo(T3);
            assertThat(ledgerOutcome("evt_d")).isEqualTo(WebhookOutcome.IGNORED_STALE);
        }

        @Test
        @DisplayName("Canceling at period end keeps the subscription ACTIVE with the flag set")
        void cancelAtPeriodEndKeepsActive() {
            // Given
            reconciliationService.applyEvent(checkoutCompleted("evt_a", T1));

            // When
            SubscriptionDto result = subscriptionService.cancelSubscription(
                    subscription.getId(), Requester.subscriber(subscriberId), false);

            // Then
            verify(billingGateway).cancelSubscription("sub_" + subscription.getId(), true);
            assertThat(result.status()).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(result.cancelAtPeriodEnd()).isTrue();
            Subscription stored = reload();
            assertThat(stored.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(stored.isCancelAtPeriodEnd()).isTrue();
            assertThat(stored.getLastEventAt()).isAfter(T1);
        }

        @Test
        @DisplayName("The provider's deletion confirms a scheduled cancellation")
        void deletionConfirmsScheduledCancel() {
            // Given
            reconciliationService.applyEvent(checkoutCompleted("evt_a", T1));
            subscriptionService.cancelSubscription(subscription.getId(), Requester.subscriber(subscriberId), false);
            Instant afterAction = reload().getLastEventAt().plusSeconds(60);

            // When
            WebhookOutcome outcome = reconciliationService.applyEvent(
                    event("evt_end", BillingEventType.SUBSCRIPTION_DELETED, afterAction, SubscriptionStatus.CANCELED));

            // Then
            assertThat(outcome).isEqualTo(WebhookOutcome.APPLIED);
            assertThat(reload().getStatus()).isEqualTo(SubscriptionStatus.CANCELED);
        }
    }

    @Nested
    @DisplayName("Ordering and idempotency")
    class OrderingAndIdempotency {

        @Test
        @DisplayName("Events for a canceled subscription never revive it")
        void canceledNeverRevives() {
            // Given
            reconciliationService.applyEvent(checkoutCompleted("evt_a", T1));
            reconciliationService.applyEvent(event("evt_del", BillingEventType.SUBSCRIPTION_DELETED, T4, SubscriptionStatus.CANCELED));

            // When
            WebhookOutcome outcome = reconciliationService.applyEvent(
                    event("evt_late", BillingEventType.PAYMENT_SUCCEEDED, T4.plusSeconds(3600), null));

            // Then
            assertThat(outcome).isEqualTo(WebhookOutcome.IGNORED_STALE);
            assertThat(reload().getStatus()).isEqualTo(SubscriptionStatus.CANCELED);
        }

        @Test
        @DisplayName("A different event with the same timestamp as the last applied one is stale")
        void equalTimestampIsStale() {
            // Given
            reconciliationService.applyEvent(checkoutCompleted("evt_a", T1));

            // When
            WebhookOutcome outcome = reconciliationService.applyEvent(event("evt_tie", BillingEventType.PAYMENT_FAILED, T1, null));

            // Then
            assertThat(outcome).isEqualTo(WebhookOutcome.IGNORED_STALE);
            assertThat(reload().getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        }

        @Test
        @DisplayName("Events applied out of order converge on the newest one")
        void outOfOrderConverges() {
            // Given
            reconciliationService.applyEvent(checkoutCompleted("evt_a", T1));

            // When
            reconciliationService.applyEvent(event("evt_new", BillingEventType.SUBSCRIPTION_UPDATED, T3, SubscriptionStatus.PAST_DUE));
            WebhookOutcome older = reconciliationService.applyEvent(
                    event("evt_old", BillingEventType.SUBSCRIPTION_UPDATED, T2, SubscriptionStatus.ACTIVE));

            // Then
            assertThat(older).isEqualTo(WebhookOutcome.IGNORED_STALE);
            Subscription stored = reload();
            assertThat(stored.getStatus()).isEqualTo(SubscriptionStatus.PAST_DUE);
            assertThat(stored.getLastEventAt()).isEqualTo(T3);
        }

        @Test
        @DisplayName("Unhandled event types are recorded for audit without touching subscriptions")
        void unhandledTypeIsRecorded() {
            // Given
            BillingEvent unhandled = BillingEvent.builder()
                    .externalEventId("evt_unhandled")
                    .provider(SignedEnvelopeEventReader.PROVIDER)
                    .rawType("customer.created")
                    .occurredAt(T1)
                    .build();

            // When
            WebhookOutcome outcome = reconciliationService.applyEvent(unhandled);

            // Then
            assertThat(outcome).isEqualTo(WebhookOutcome.IGNORED_UNHANDLED);
            assertThat(ledgerOutcome("evt_unhandled")).isEqualTo(WebhookOutcome.IGNORED_UNHANDLED);
            assertThat(reload().getStatus()).isEqualTo(SubscriptionStatus.INCOMPLETE);
        }

        @Test
        @DisplayName("A paid invoice arriving before checkout completion finds the row by checkout reference")
        void earlyInvoiceMatchesByCheckoutReference() {
            // Given
            BillingEvent earlyInvoice = BillingEvent.builder()
                    .externalEventId("evt_early")
                    .provider(SignedEnvelopeEventReader.PROVIDER)
                    .rawType(BillingEventType.PAYMENT_SUCCEEDED.wireName())
                    .type(BillingEventType.PAYMENT_SUCCEEDED)
                    .occurredAt(T1)
                    .externalSubscriptionId("sub_early")
                    .checkoutReference(subscription.getCheckoutReference())
                    .build();

            // When
            WebhookOutcome outcome = reconciliationService.applyEvent(earlyInvoice);

            // Then
            assertThat(outcome).isEqualTo(WebhookOutcome.APPLIED);
            Subscription stored = reload();
            assertThat(stored.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(stored.getExternalSubscriptionId()).isEqualTo("sub_early");
        }

        @Test
        @DisplayName("An event for an unknown subscription rolls back and leaves no ledger row")
        void unknownSubscriptionLeavesNoTrace() {
            // Given
            BillingEvent orphan = BillingEvent.builder()
                    .externalEventId("evt_orphan")
                    .provider(SignedEnvelopeEventReader.PROVIDER)
                    .rawType(BillingEventType.PAYMENT_FAILED.wireName())
                    .type(BillingEventType.PAYMENT_FAILED)
                    .occurredAt(T1)
                    .externalSubscriptionId("sub_missing")
                    .build();

            // When / Then
            assertThatThrownBy(() -> reconciliationService.applyEvent(orphan))
                    .isInstanceOf(UnknownSubscriptionException.class);
            assertThat(webhookEventRepository.existsById("evt_orphan")).isFalse();
        }
    }

    @Nested
    @DisplayName("Webhook delivery")
    class WebhookDelivery {

        @Test
        @DisplayName("Concurrent deliveries of one event apply it exactly once")
        void concurrentDuplicateDelivery() throws Exception {
            // Given
            String payload = envelope("evt_race", "checkout.completed", T1, subscription);
            String signature = signatureVerifier.sign(payload, SIGNING_SECRET);
            int threads = 6;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<WebhookOutcome>> futures = new ArrayList<>();

            // When
            try {
                for (int i = 0; i < threads; i++) {
                    Callable<WebhookOutcome> delivery = () -> {
                        start.await();
                        return webhookService.process(SignedEnvelopeEventReader.PROVIDER, payload, signature);
                    };
                    futures.add(executor.submit(delivery));
                }
                start.countDown();

                List<WebhookOutcome> outcomes = new ArrayList<>();
                for (Future<WebhookOutcome> future : futures) {
                    outcomes.add(future.get(30, TimeUnit.SECONDS));
                }

                // Then
                assertThat(outcomes).filteredOn(o -> o == WebhookOutcome.APPLIED).hasSize(1);
                assertThat(outcomes).filteredOn(o -> o != WebhookOutcome.APPLIED)
                        .containsOnly(WebhookOutcome.IGNORED_DUPLICATE);
            } finally {
                executor.shutdownNow();
            }
            assertThat(webhookEventRepository.count()).isEqualTo(1);
            assertThat(reload().getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        }

        @Test
        @DisplayName("A second activation for the same subscriber and plan is recorded as failed")
        void secondActivationConflicts() {
            // Given
            Subscription second = newIncomplete(subscriberId, planId);
            String first = envelope("evt_first", "checkout.completed", T1, subscription);
            String duplicatePair = envelope("evt_second", "checkout.completed", T2, second);

            // When
            WebhookOutcome firstOutcome = webhookService.process(SignedEnvelopeEventReader.PROVIDER, first,
                    signatureVerifier.sign(first, SIGNING_SECRET));
            WebhookOutcome secondOutcome = webhookService.process(SignedEnvelopeEventReader.PROVIDER, duplicatePair,
                    signatureVerifier.sign(duplicatePair, SIGNING_SECRET));

            // Then
            assertThat(firstOutcome).isEqualTo(WebhookOutcome.APPLIED);
            assertThat(secondOutcome).isEqualTo(WebhookOutcome.FAILED);
            assertThat(ledgerOutcome("evt_second")).isEqualTo(WebhookOutcome.FAILED);
            assertThat(subscriptionRepository.findById(second.getId()).orElseThrow().getStatus())
                    .isEqualTo(SubscriptionStatus.INCOMPLETE);
            assertThat(reload().getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        }

        @Test
        @DisplayName("A redelivered envelope is acknowledged as a duplicate")
        void redeliveredEnvelope() {
            // Given
            String payload = envelope("evt_twice", "checkout.completed", T1, subscription);
            String signature = signatureVerifier.sign(payload, SIGNING_SECRET);
            webhookService.process(SignedEnvelopeEventReader.PROVIDER, payload, signature);

            // When
            WebhookOutcome outcome = webhookService.process(SignedEnvelopeEventReader.PROVIDER, payload, signature);

            // Then
            assertThat(outcome).isEqualTo(WebhookOutcome.IGNORED_DUPLICATE);
            assertThat(webhookEventRepository.count()).isEqualTo(1);
        }
    }

    private Subscription newIncomplete(UUID subscriber, UUID plan) {
        Subscription s = new Subscription();
        s.setSubscriberId(subscriber);
        s.setPlanId(plan);
        s.setStatus(SubscriptionStatus.INCOMPLETE);
        s.setCheckoutReference(UUID.randomUUID().toString());
        s.setPrice(500);
        s.setCurrency("USD");
        return subscriptionRepository.save(s);
    }

    private Subscription reload() {
        return subscriptionRepository.findById(subscription.getId()).orElseThrow();
    }

    private WebhookOutcome ledgerOutcome(String eventId) {
        return webhookEventRepository.findById(eventId)
                .map(WebhookEvent::getProcessingOutcome)
                .orElse(null);
    }

    private BillingEvent checkoutCompleted(String eventId, Instant occurredAt) {
        return BillingEvent.builder()
                .externalEventId(eventId)
                .provider(SignedEnvelopeEventReader.PROVIDER)
                .rawType(BillingEventType.CHECKOUT_COMPLETED.wireName())
                .type(BillingEventType.CHECKOUT_COMPLETED)
                .occurredAt(occurredAt)
                .checkoutReference(subscription.getCheckoutReference())
                .externalSubscriptionId("sub_" + subscription.getId())
                .providerStatus(SubscriptionStatus.ACTIVE)
                .currentPeriodStart(occurredAt)
                .currentPeriodEnd(occurredAt.plusSeconds(30L * 24 * 3600))
                .build();
    }

    private BillingEvent event(String eventId, BillingEventType type, Instant occurredAt, SubscriptionStatus providerStatus) {
        return BillingEvent.builder()
                .externalEventId(eventId)
                .provider(SignedEnvelopeEventReader.PROVIDER)
                .rawType(type.wireName())
                .type(type)
                .occurredAt(occurredAt)
                .externalSubscriptionId("sub_" + subscription.getId())
                .providerStatus(providerStatus)
                .build();
    }

    private static String envelope(String eventId, String type, Instant occurredAt, Subscription target) {
        return """
                {"external_event_id":"%s","type":"%s","occurred_at":"%s",
                 "data":{"external_subscription_id":"sub_%s","status":"active","checkout_reference":"%s"}}
                """.formatted(eventId, type, occurredAt, target.getId(), target.getCheckoutReference());
    }
}
