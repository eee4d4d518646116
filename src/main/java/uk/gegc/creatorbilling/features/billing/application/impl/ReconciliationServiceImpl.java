package uk.gegc.creatorbilling.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creatorbilling.features.billing.application.BillingMetricsService;
import uk.gegc.creatorbilling.features.billing.application.ReconciliationService;
import uk.gegc.creatorbilling.features.billing.application.WebhookLedgerService;
import uk.gegc.creatorbilling.features.billing.domain.event.SubscriptionTransitionedEvent;
import uk.gegc.creatorbilling.features.billing.domain.exception.EntitlementConflictException;
import uk.gegc.creatorbilling.features.billing.domain.exception.InvalidSubscriptionStateException;
import uk.gegc.creatorbilling.features.billing.domain.exception.UnknownSubscriptionException;
import uk.gegc.creatorbilling.features.billing.domain.model.BillingEvent;
import uk.gegc.creatorbilling.features.billing.domain.model.Subscription;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionStateMachine;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionStatus;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionTransition;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionTrigger;
import uk.gegc.creatorbilling.features.billing.domain.model.WebhookOutcome;
import uk.gegc.creatorbilling.features.billing.infra.repository.SubscriptionRepository;
import uk.gegc.creatorbilling.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationServiceImpl implements ReconciliationService {

    private static final Set<SubscriptionTrigger> USER_ACTIONS = EnumSet.of(
            SubscriptionTrigger.CANCEL_SCHEDULED,
            SubscriptionTrigger.CANCELED_IMMEDIATELY,
            SubscriptionTrigger.REACTIVATED);

    private final SubscriptionRepository subscriptionRepository;
    private final WebhookLedgerService ledgerService;
    private final BillingMetricsService metricsService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    @Transactional
    public WebhookOutcome applyEvent(BillingEvent event) {
        if (!ledgerService.recordIfNew(event)) {
            log.info("Event {} already recorded in ledger; skipping", event.externalEventId());
            return WebhookOutcome.IGNORED_DUPLICATE;
        }

        WebhookOutcome outcome;
        if (!event.isHandled()) {
            log.info("Event {} of type {} is not handled; recorded for audit only", event.externalEventId(), event.rawType());
            outcome = WebhookOutcome.IGNORED_UNHANDLED;
        } else {
            outcome = reconcile(event);
        }

        ledgerService.finalizeOutcome(event.externalEventId(), outcome);
        return outcome;
    }

    @Override
    @Transactional
    public Subscription applyUserAction(UUID subscriptionId, SubscriptionTrigger action) {
        if (!USER_ACTIONS.contains(action)) {
            throw new IllegalArgumentException("Not a user action: " + action);
        }
        Subscription current = subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new ResourceNotFoundException("Subscription " + subscriptionId + " not found"));

        SubscriptionStatus target = SubscriptionStateMachine.targetFor(current.getStatus(), action, null)
                .orElseThrow(() -> new InvalidSubscriptionStateException(
                        "Cannot apply " + action + " to a subscription in status " + current.getStatus(),
                        current.getStatus()));

        Instant occurredAt = actionTimestamp(current);
        boolean cancelAtPeriodEnd = switch (action) {
            case CANCEL_SCHEDULED -> true;
            case REACTIVATED -> false;
            default -> current.isCancelAtPeriodEnd();
        };
        SubscriptionTransition transition = SubscriptionTransition.from(current, target, occurredAt, occurredAt)
                .toBuilder()
                .cancelAtPeriodEnd(cancelAtPeriodEnd)
                .build();

        if (write(current, transition, action)) {
            log.info("Applied {} to subscription {} ({} -> {})", action, subscriptionId, current.getStatus(), target);
        } else {
            log.info("{} on subscription {} lost to a concurrent write; returning committed state", action, subscriptionId);
        }
        return subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new ResourceNotFoundException("Subscription " + subscriptionId + " not found"));
    }

    private WebhookOutcome reconcile(BillingEvent event) {
        Subscription subscription = locate(event);
        SubscriptionTrigger trigger = event.type().trigger();
        Instant occurredAt = event.occurredAt();

        Optional<SubscriptionStatus> target =
                SubscriptionStateMachine.targetFor(subscription.getStatus(), trigger, event.providerStatus());
        if (target.isEmpty()) {
            log.info("Rejected {} for subscription {} in status {} (event {} at {})",
                    trigger, subscription.getId(), subscription.getStatus(), event.externalEventId(), occurredAt);
            return WebhookOutcome.IGNORED_STALE;
        }

        SubscriptionTransition transition = transitionFor(subscription, target.get(), event);
        if (write(subscription, transition, trigger)) {
            log.info("Applied {} to subscription {} ({} -> {}) at {}",
                    trigger, subscription.getId(), subscription.getStatus(), target.get(), occurredAt);
            return WebhookOutcome.APPLIED;
        }

        Subscription committed = subscriptionRepository.findById(subscription.getId()).orElse(subscription);
        WebhookOutcome outcome = isSameTransition(committed, transition)
                ? WebhookOutcome.IGNORED_DUPLICATE
                : WebhookOutcome.IGNORED_STALE;
        log.info("Event {} for subscription {} ignored as {} (occurredAt={}, lastEventAt={}, status={})",
                event.externalEventId(), subscription.getId(), outcome, occurredAt,
                committed.getLastEventAt(), committed.getStatus());
        return outcome;
    }

    private Subscription locate(BillingEvent event) {
        if (event.checkoutReference() != null) {
            Optional<Subscription> byReference = subscriptionRepository.findByCheckoutReference(event.checkoutReference());
            if (byReference.isPresent()) {
                return byReference.get();
            }
        }
        if (event.externalSubscriptionId() != null) {
            Optional<Subscription> byExternalId =
                    subscriptionRepository.findByExternalSubscriptionId(event.externalSubscriptionId());
            if (byExternalId.isPresent()) {
                return byExternalId.get();
            }
        }
        throw new UnknownSubscriptionException("No subscription matches event " + event.externalEventId()
                + " (externalSubscriptionId=" + event.externalSubscriptionId()
                + ", checkoutReference=" + event.checkoutReference() + ")");
    }

    private SubscriptionTransition transitionFor(Subscription current, SubscriptionStatus target, BillingEvent event) {
        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
        SubscriptionTransition.SubscriptionTransitionBuilder builder =
                SubscriptionTransition.from(current, target, event.occurredAt(), now).toBuilder();

        if (event.externalSubscriptionId() != null) {
            if (current.getExternalSubscriptionId() == null) {
                builder.externalSubscriptionId(event.externalSubscriptionId());
            } else if (!current.getExternalSubscriptionId().equals(event.externalSubscriptionId())) {
                log.warn("Event {} carries external subscription {} but subscription {} is linked to {}; keeping existing link",
                        event.externalEventId(), event.externalSubscriptionId(), current.getId(),
                        current.getExternalSubscriptionId());
            }
        }
        if (event.currentPeriodStart() != null) {
            builder.currentPeriodStart(event.currentPeriodStart());
        }
        if (event.currentPeriodEnd() != null) {
            builder.currentPeriodEnd(event.currentPeriodEnd());
        }
        if (event.cancelAtPeriodEnd() != null) {
            builder.cancelAtPeriodEnd(event.cancelAtPeriodEnd());
        }
        return builder.build();
    }

    private boolean write(Subscription current, SubscriptionTransition transition, SubscriptionTrigger trigger) {
        int updated;
        try {
            updated = subscriptionRepository.applyTransition(transition);
        } catch (DataIntegrityViolationException e) {
            throw new EntitlementConflictException(current.getId(), e);
        }
        if (updated == 0) {
            return false;
        }

        if (transition.changesStatus()) {
            metricsService.incrementSubscriptionTransition(transition.expectedStatus(), transition.targetStatus());
        }
        eventPublisher.publishEvent(new SubscriptionTransitionedEvent(
                this,
                current.getId(),
                current.getSubscriberId(),
                current.getPlanId(),
                transition.expectedStatus(),
                transition.targetStatus(),
                trigger,
                transition.cancelAtPeriodEnd(),
                transition.occurredAt()));
        return true;
    }

    private boolean isSameTransition(Subscription committed, SubscriptionTransition transition) {
        return committed.getStatus() == transition.targetStatus()
                && committed.isCancelAtPeriodEnd() == transition.cancelAtPeriodEnd()
                && Objects.equals(committed.getLastEventAt(), transition.occurredAt());
    }

    private Instant actionTimestamp(Subscription current) {
        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
        Instant last = current.getLastEventAt();
        if (last != null && !now.isAfter(last)) {
            return last.plus(1, ChronoUnit.MICROS);
        }
        return now;
    }
}
