package uk.gegc.creatorbilling.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import uk.gegc.creatorbilling.features.billing.api.dto.BillingPortalResponse;
import uk.gegc.creatorbilling.features.billing.api.dto.CheckoutResponse;
import uk.gegc.creatorbilling.features.billing.api.dto.CreateSubscriptionRequest;
import uk.gegc.creatorbilling.features.billing.api.dto.SubscriptionDto;
import uk.gegc.creatorbilling.features.billing.application.BillingGateway;
import uk.gegc.creatorbilling.features.billing.application.BillingMetricsService;
import uk.gegc.creatorbilling.features.billing.application.BillingProperties;
import uk.gegc.creatorbilling.features.billing.application.CheckoutRequest;
import uk.gegc.creatorbilling.features.billing.application.CheckoutSession;
import uk.gegc.creatorbilling.features.billing.application.ReconciliationService;
import uk.gegc.creatorbilling.features.billing.application.Requester;
import uk.gegc.creatorbilling.features.billing.application.SubscriptionService;
import uk.gegc.creatorbilling.features.billing.domain.exception.ExternalGatewayException;
import uk.gegc.creatorbilling.features.billing.domain.exception.InvalidSubscriptionStateException;
import uk.gegc.creatorbilling.features.billing.domain.exception.SubscriptionAlreadyCanceledException;
import uk.gegc.creatorbilling.features.billing.domain.exception.SubscriptionConflictException;
import uk.gegc.creatorbilling.features.billing.domain.model.Plan;
import uk.gegc.creatorbilling.features.billing.domain.model.Subscription;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionStatus;
import uk.gegc.creatorbilling.features.billing.domain.model.SubscriptionTrigger;
import uk.gegc.creatorbilling.features.billing.infra.mapping.SubscriptionMapper;
import uk.gegc.creatorbilling.features.billing.infra.repository.PlanRepository;
import uk.gegc.creatorbilling.features.billing.infra.repository.SubscriptionRepository;
import uk.gegc.creatorbilling.features.subscriber.application.SubscriberService;
import uk.gegc.creatorbilling.features.subscriber.domain.model.Subscriber;
import uk.gegc.creatorbilling.shared.exception.ForbiddenException;
import uk.gegc.creatorbilling.shared.exception.ResourceNotFoundException;
import uk.gegc.creatorbilling.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionServiceImpl implements SubscriptionService {

    private static final Set<SubscriptionStatus> LIVE_STATUSES = EnumSet.of(SubscriptionStatus.ACTIVE, SubscriptionStatus.PAST_DUE);

    private final SubscriptionRepository subscriptionRepository;
    private final PlanRepository planRepository;
    private final SubscriberService subscriberService;
    private final BillingGateway billingGateway;
    private final ReconciliationService reconciliationService;
    private final BillingMetricsService metricsService;
    private final BillingProperties billingProperties;
    private final SubscriptionMapper subscriptionMapper;
    private final Clock clock;

    @Override
    public CheckoutResponse createSubscription(UUID subscriberId, CreateSubscriptionRequest request) {
        if (request.trialDays() != null && request.trialDays() > billingProperties.getMaxTrialDays()) {
            throw new ValidationException("Trial days must be at most " + billingProperties.getMaxTrialDays());
        }

        Plan plan = planRepository.findById(request.planId())
                .filter(Plan::isActive)
                .orElseThrow(() -> new ResourceNotFoundException("Plan " + request.planId() + " not found"));
        if (!plan.isSubscribable()) {
            throw new ValidationException("Plan " + plan.getId() + " has no provider price configured");
        }

        Subscriber subscriber = subscriberService.requireSubscriber(subscriberId);

        if (subscriptionRepository.existsBySubscriberIdAndPlanIdAndStatusIn(subscriberId, plan.getId(), LIVE_STATUSES)) {
            throw new SubscriptionConflictException(subscriberId, plan.getId());
        }

        String customerRef = resolveCustomer(subscriber);

        // The row must exist before the provider knows the reference, or an early webhook finds nothing to update.
        Subscription subscription = new Subscription();
        subscription.setSubscriberId(subscriberId);
        subscription.setPlanId(plan.getId());
        subscription.setStatus(SubscriptionStatus.INCOMPLETE);
        subscription.setCheckoutReference(UUID.randomUUID().toString());
        subscription.setPrice(plan.getPrice());
        subscription.setCurrency(plan.getCurrency());
        Instant now = Instant.now(clock);
        subscription.setCreatedAt(now);
        subscription.setUpdatedAt(now);
        Subscription saved = subscriptionRepository.save(subscription);

        CheckoutSession session;
        try {
            session = billingGateway.createCheckoutSession(CheckoutRequest.builder()
                    .customerRef(customerRef)
                    .externalPriceId(plan.getExternalPriceId())
                    .trialDays(request.trialDays())
                    .couponCode(StringUtils.hasText(request.couponCode()) ? request.couponCode().trim() : null)
                    .checkoutReference(saved.getCheckoutReference())
                    .subscriberId(subscriberId)
                    .planId(plan.getId())
                    .paymentMethodRef(request.paymentMethodRef())
                    .build());
        } catch (ExternalGatewayException e) {
            log.warn("Checkout session creation failed for subscription={}; it stays INCOMPLETE without a session",
                    saved.getId());
            throw e;
        }

        subscriptionRepository.attachCheckoutSession(saved.getId(), session.sessionId(), Instant.now(clock));

        metricsService.incrementCheckoutStarted();
        log.info("Started checkout session={} for subscriber={} plan={} subscription={}",
                session.sessionId(), subscriberId, plan.getId(), saved.getId());
        return new CheckoutResponse(saved.getId(), session.url(), session.sessionId());
    }

    @Override
    @Transactional(readOnly = true)
    public SubscriptionDto getSubscription(UUID subscriptionId, Requester requester) {
        return subscriptionMapper.toDto(loadOwned(subscriptionId, requester));
    }

    @Override
    @Transactional(readOnly = true)
    public List<SubscriptionDto> listSubscriptions(UUID subscriberId) {
        return subscriptionMapper.toDtos(subscriptionRepository.findBySubscriberIdOrderByCreatedAtDesc(subscriberId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<SubscriptionDto> listActiveSubscriptions(UUID subscriberId) {
        return subscriptionMapper.toDtos(subscriptionRepository
                .findBySubscriberIdAndStatusOrderByCreatedAtDesc(subscriberId, SubscriptionStatus.ACTIVE));
    }

    @Override
    public SubscriptionDto cancelSubscription(UUID subscriptionId, Requester requester, boolean immediately) {
        Subscription subscription = loadOwned(subscriptionId, requester);

        if (subscription.getStatus() == SubscriptionStatus.CANCELED) {
            throw new SubscriptionAlreadyCanceledException(subscriptionId);
        }
        if (subscription.getStatus() != SubscriptionStatus.ACTIVE) {
            throw new InvalidSubscriptionStateException(
                    "Only active subscriptions can be canceled; current status is " + subscription.getStatus(),
                    subscription.getStatus());
        }
        if (!immediately && subscription.isCancelAtPeriodEnd()) {
            log.info("Subscription {} is already set to cancel at period end", subscriptionId);
            return subscriptionMapper.toDto(subscription);
        }

        billingGateway.cancelSubscription(requireExternalId(subscription), !immediately);

        SubscriptionTrigger action = immediately ? SubscriptionTrigger.CANCELED_IMMEDIATELY : SubscriptionTrigger.CANCEL_SCHEDULED;
        Subscription updated = reconciliationService.applyUserAction(subscriptionId, action);
        log.info("Subscription {} canceled by {} (immediately={})", subscriptionId, requester.id(), immediately);
        return subscriptionMapper.toDto(updated);
    }

    @Override
    public SubscriptionDto reactivateSubscription(UUID subscriptionId, Requester requester) {
        Subscription subscription = loadOwned(subscriptionId, requester);

        if (subscription.getStatus() == SubscriptionStatus.CANCELED) {
            throw new SubscriptionAlreadyCanceledException(subscriptionId);
        }
        if (subscription.getStatus() != SubscriptionStatus.ACTIVE || !subscription.isCancelAtPeriodEnd()) {
            throw new InvalidSubscriptionStateException(
                    "Only active subscriptions pending cancellation can be reactivated", subscription.getStatus());
        }

        billingGateway.reactivateSubscription(requireExternalId(subscription));

        Subscription updated = reconciliationService.applyUserAction(subscriptionId, SubscriptionTrigger.REACTIVATED);
        log.info("Subscription {} reactivated by {}", subscriptionId, requester.id());
        return subscriptionMapper.toDto(updated);
    }

    @Override
    public BillingPortalResponse openBillingPortal(UUID subscriberId, String returnUrl) {
        Subscriber subscriber = subscriberService.requireSubscriber(subscriberId);
        String customerRef = resolveCustomer(subscriber);
        String effectiveReturnUrl = StringUtils.hasText(returnUrl) ? returnUrl : billingProperties.getPortalReturnUrl();
        String url = billingGateway.openBillingPortal(customerRef, effectiveReturnUrl);
        return new BillingPortalResponse(url, effectiveReturnUrl);
    }

    private Subscription loadOwned(UUID subscriptionId, Requester requester) {
        Subscription subscription = subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new ResourceNotFoundException("Subscription " + subscriptionId + " not found"));
        if (!requester.mayActOn(subscription.getSubscriberId())) {
            throw new ForbiddenException("You do not have access to subscription " + subscriptionId);
        }
        return subscription;
    }

    private String resolveCustomer(Subscriber subscriber) {
        if (StringUtils.hasText(subscriber.getExternalCustomerRef())) {
            return subscriber.getExternalCustomerRef();
        }
        String customerRef = billingGateway.resolveOrCreateCustomer(subscriber.getEmail(), subscriber.getName(), subscriber.getId());
        subscriberService.linkCustomerRef(subscriber.getId(), customerRef);
        return customerRef;
    }

    private static String requireExternalId(Subscription subscription) {
        if (!StringUtils.hasText(subscription.getExternalSubscriptionId())) {
            throw new InvalidSubscriptionStateException(
                    "Subscription " + subscription.getId() + " is not linked to a provider subscription yet",
                    subscription.getStatus());
        }
        return subscription.getExternalSubscriptionId();
    }
}
