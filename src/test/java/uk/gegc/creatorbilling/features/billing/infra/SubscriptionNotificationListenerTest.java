package uk.gegc.creatorbilling.features.billing.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.creatorbilling.features.billing.domain.event.SubscriptionTransitionedEvent;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionStatus;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionTrigger;
import uk.gegc.creatorbilling.features.billing.infra.SubscriptionNotificationListener.NotificationKind;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Subscription notifications")
class SubscriptionNotificationListenerTest {

    @Test
    @DisplayName("a first activation starts the subscription")
    void started() {
        assertThat(classify(SubscriptionStatus.INCOMPLETE, SubscriptionStatus.ACTIVE, SubscriptionTrigger.CHECKOUT_COMPLETED))
                .isEqualTo(NotificationKind.SUBSCRIPTION_STARTED);
    }

    @Test
    @DisplayName("payment failures notify once, on entering PAST_DUE")
    void paymentFailed() {
        assertThat(classify(SubscriptionStatus.ACTIVE, SubscriptionStatus.PAST_DUE, SubscriptionTrigger.PAYMENT_FAILED))
                .isEqualTo(NotificationKind.PAYMENT_FAILED);
        assertThat(classify(SubscriptionStatus.PAST_DUE, SubscriptionStatus.PAST_DUE, SubscriptionTrigger.PAYMENT_FAILED))
                .isNull();
    }

    @Test
    @DisplayName("a recovered payment is announced")
    void recovered() {
        assertThat(classify(SubscriptionStatus.PAST_DUE, SubscriptionStatus.ACTIVE, SubscriptionTrigger.PAYMENT_SUCCEEDED))
                .isEqualTo(NotificationKind.PAYMENT_RECOVERED);
    }

    @Test
    @DisplayName("scheduling and withdrawing a cancellation are distinct notices")
    void cancellationFlag() {
        assertThat(classify(SubscriptionStatus.ACTIVE, SubscriptionStatus.ACTIVE, SubscriptionTrigger.CANCEL_SCHEDULED))
                .isEqualTo(NotificationKind.CANCELLATION_SCHEDULED);
        assertThat(classify(SubscriptionStatus.ACTIVE, SubscriptionStatus.ACTIVE, SubscriptionTrigger.REACTIVATED))
                .isEqualTo(NotificationKind.CANCELLATION_WITHDRAWN);
    }

    @Test
    @DisplayName("any move into CANCELED ends the subscription")
    void ended() {
        assertThat(classify(SubscriptionStatus.ACTIVE, SubscriptionStatus.CANCELED, SubscriptionTrigger.PROVIDER_DELETED))
                .isEqualTo(NotificationKind.SUBSCRIPTION_ENDED);
        assertThat(classify(SubscriptionStatus.PAST_DUE, SubscriptionStatus.CANCELED, SubscriptionTrigger.PROVIDER_UPDATED))
                .isEqualTo(NotificationKind.SUBSCRIPTION_ENDED);
    }

    @Test
    @DisplayName("a renewal payment on an active subscription is silent")
    void renewalSilent() {
        assertThat(classify(SubscriptionStatus.ACTIVE, SubscriptionStatus.ACTIVE, SubscriptionTrigger.PAYMENT_SUCCEEDED))
                .isNull();
    }

    private static NotificationKind classify(SubscriptionStatus from, SubscriptionStatus to, SubscriptionTrigger trigger) {
        return SubscriptionNotificationListener.classify(new SubscriptionTransitionedEvent(
                SubscriptionNotificationListenerTest.class,
                UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                from, to, trigger, false, Instant.parse("2025-01-01T00:00:00Z")));
    }
}
