package uk.gegc.creatorbilling.features.billing.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.creatorbilling.features.billing.domain.event.SubscriptionTransitionedEvent;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionStatus;

/**
 * Hands committed subscription transitions to the subscriber notification channel.
 * <p>
 * Runs only after the transaction that applied the transition commits, so a rolled back or ignored
 * event never produces a notification. Delivery itself belongs to the external mail collaborator.
 * </p>
 */
@Slf4j
@Component
public class SubscriptionNotificationListener {

    public enum NotificationKind {
        SUBSCRIPTION_STARTED,
        PAYMENT_FAILED,
        PAYMENT_RECOVERED,
        CANCELLATION_SCHEDULED,
        CANCELLATION_WITHDRAWN,
        SUBSCRIPTION_ENDED
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onSubscriptionTransitioned(SubscriptionTransitionedEvent event) {
        NotificationKind kind = classify(event);
        if (kind == null) {
            log.debug("No notification for subscription {} transition {} -> {} ({})",
                    event.getSubscriptionId(), event.getFromStatus(), event.getToStatus(), event.getTrigger());
            return;
        }
        log.info("Queued {} notification for subscriber {} (subscription={}, plan={})",
                kind, event.getSubscriberId(), event.getSubscriptionId(), event.getPlanId());
    }

    static NotificationKind classify(SubscriptionTransitionedEvent event) {
        SubscriptionStatus from = event.getFromStatus();
        SubscriptionStatus to = event.getToStatus();
        if (to == SubscriptionStatus.CANCELED) {
            return NotificationKind.SUBSCRIPTION_ENDED;
        }
        if (to == SubscriptionStatus.PAST_DUE && from != SubscriptionStatus.PAST_DUE) {
            return NotificationKind.PAYMENT_FAILED;
        }
        if (to == SubscriptionStatus.ACTIVE) {
            if (from == SubscriptionStatus.INCOMPLETE) {
                return NotificationKind.SUBSCRIPTION_STARTED;
            }
            if (from == SubscriptionStatus.PAST_DUE) {
                return NotificationKind.PAYMENT_RECOVERED;
            }
            switch (event.getTrigger()) {
                case CANCEL_SCHEDULED:
                    return NotificationKind.CANCELLATION_SCHEDULED;
                case REACTIVATED:
                    return NotificationKind.CANCELLATION_WITHDRAWN;
                default:
                    return null;
            }
        }
        return null;
    }
}
