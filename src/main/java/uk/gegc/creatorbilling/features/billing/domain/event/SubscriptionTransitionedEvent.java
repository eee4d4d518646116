package uk.gegc.creatorbilling.features.billing.domain.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionStatus;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionTrigger;

import java.time.Instant;
import java.util.UUID;

/**
 * Published inside the transaction that applied a transition; listeners run after commit only.
 */
@Getter
public class SubscriptionTransitionedEvent extends ApplicationEvent {

    private final UUID subscriptionId;
    private final UUID subscriberId;
    private final UUID planId;
    private final SubscriptionStatus fromStatus;
    private final SubscriptionStatus toStatus;
    private final SubscriptionTrigger trigger;
    private final boolean cancelAtPeriodEnd;
    private final Instant occurredAt;

    public SubscriptionTransitionedEvent(Object source,
                                         UUID subscriptionId,
                                         UUID subscriberId,
                                         UUID planId,
                                         SubscriptionStatus fromStatus,
                                         SubscriptionStatus toStatus,
                                         SubscriptionTrigger trigger,
                                         boolean cancelAtPeriodEnd,
                                         Instant occurredAt) {
        super(source);
        this.subscriptionId = subscriptionId;
        this.subscriberId = subscriberId;
        this.planId = planId;
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
        this.trigger = trigger;
        this.cancelAtPeriodEnd = cancelAtPeriodEnd;
        this.occurredAt = occurredAt;
    }
}
