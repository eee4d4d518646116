package uk.gegc.creatorbilling.features.billing.infra.stripe;

import com.stripe.StripeClient;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.StripeException;
import com.stripe.model.Customer;
import com.stripe.model.Price;
import com.stripe.model.Product;
import com.stripe.model.checkout.Session;
import com.stripe.param.CustomerCreateParams;
import com.stripe.param.CustomerListParams;
import com.stripe.param.PriceCreateParams;
import com.stripe.param.ProductCreateParams;
import com.stripe.param.SubscriptionCancelParams;
import com.stripe.param.SubscriptionUpdateParams;
import com.stripe.param.checkout.SessionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.creatorbilling.features.billing.application.BillingGateway;
import uk.gegc.creatorbilling.features.billing.application.BillingMetricsService;
import uk.gegc.creatorbilling.features.billing.application.CheckoutRequest;
import uk.gegc.creatorbilling.features.billing.application.CheckoutSession;
import uk.gegc.creatorbilling.features.billing.application.RecurringPriceRequest;
import uk.gegc.creatorbilling.features.billing.application.StripeProperties;
import uk.gegc.creatorbilling.features.billing.domain.exception.ExternalGatewayException;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * {@link BillingGateway} backed by Stripe.
 *
 * <p>Connection-level failures get exactly one retry. Errors the API answered (4xx, 5xx) are not retried here;
 * they surface as {@link ExternalGatewayException} flagged retryable for 429 and 5xx.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StripeBillingGateway implements BillingGateway {

    static final String PROVIDER = "stripe";

    private final ObjectProvider<StripeClient> stripeClientProvider;
    private final StripeProperties stripeProperties;
    private final BillingMetricsService metricsService;

    @FunctionalInterface
    interface StripeCall<T> {
        T execute(StripeClient client) throws StripeException;
    }

    @Override
    public String providerName() {
        return PROVIDER;
    }

    @Override
    public CheckoutSession createCheckoutSession(CheckoutRequest request) {
        if (!StringUtils.hasText(request.externalPriceId())) {
            throw new IllegalArgumentException("externalPriceId must be provided for a checkout session");
        }

        String successUrl = stripeProperties.getSuccessUrl();
        // Ensure success URL carries the session id back to the frontend
        if (StringUtils.hasText(successUrl) && !successUrl.contains("{CHECKOUT_SESSION_ID}")) {
            successUrl = successUrl + (successUrl.contains("?") ? "&" : "?") + "session_id={CHECKOUT_SESSION_ID}";
        }

        SessionCreateParams.SubscriptionData.Builder subscriptionData = SessionCreateParams.SubscriptionData.builder()
                .putMetadata("subscriberId", request.subscriberId().toString())
                .putMetadata("planId", request.planId().toString())
                .putMetadata("checkoutReference", request.checkoutReference());
        if (request.trialDays() != null && request.trialDays() > 0) {
            subscriptionData.setTrialPeriodDays(request.trialDays().longValue());
        }

        SessionCreateParams.Builder params = SessionCreateParams.builder()
                .setMode(SessionCreateParams.Mode.SUBSCRIPTION)
                .setCustomer(request.customerRef())
                .setSuccessUrl(successUrl)
                .setCancelUrl(stripeProperties.getCancelUrl())
                .setClientReferenceId(request.checkoutReference())
                .addLineItem(SessionCreateParams.LineItem.builder()
                        .setQuantity(1L)
                        .setPrice(request.externalPriceId())
                        .build())
                .setSubscriptionData(subscriptionData.build())
                .putMetadata("subscriberId", request.subscriberId().toString())
                .putMetadata("planId", request.planId().toString());
        if (StringUtils.hasText(request.paymentMethodRef())) {
            params.putMetadata("paymentMethodRef", request.paymentMethodRef());
        }
        if (StringUtils.hasText(request.couponCode())) {
            params.addDiscount(SessionCreateParams.Discount.builder().setCoupon(request.couponCode()).build());
        }

        SessionCreateParams built = params.build();
        Session session = call("createCheckoutSession", client -> client.checkout().sessions().create(built));
        log.info("Created Stripe Checkout session id={} for subscriber={} priceId={} reference={}",
                session.getId(), request.subscriberId(), request.externalPriceId(), request.checkoutReference());
        return new CheckoutSession(session.getId(), session.getUrl());
    }

    @Override
    public void cancelSubscription(String externalSubscriptionId, boolean atPeriodEnd) {
        if (atPeriodEnd) {
            SubscriptionUpdateParams params = SubscriptionUpdateParams.builder().setCancelAtPeriodEnd(true).build();
            call("cancelSubscription", client -> client.subscriptions().update(externalSubscriptionId, params));
        } else {
            call("cancelSubscription", client -> client.subscriptions()
                    .cancel(externalSubscriptionId, SubscriptionCancelParams.builder().build()));
        }
        log.info("Canceled Stripe subscription id={} atPeriodEnd={}", externalSubscriptionId, atPeriodEnd);
    }

    @Override
    public void reactivateSubscription(String externalSubscriptionId) {
        SubscriptionUpdateParams params = SubscriptionUpdateParams.builder().setCancelAtPeriodEnd(false).build();
        call("reactivateSubscription", client -> client.subscriptions().update(externalSubscriptionId, params));
        log.info("Reactivated Stripe subscription id={}", externalSubscriptionId);
    }

    @Override
    public String openBillingPortal(String customerRef, String returnUrl) {
        com.stripe.param.billingportal.SessionCreateParams params = com.stripe.param.billingportal.SessionCreateParams.builder()
                .setCustomer(customerRef)
                .setReturnUrl(returnUrl)
                .build();
        com.stripe.model.billingportal.Session session =
                call("openBillingPortal", client -> client.billingPortal().sessions().create(params));
        return session.getUrl();
    }

    @Override
    public String resolveOrCreateCustomer(String email, String name, UUID subscriberId) {
        if (!StringUtils.hasText(email)) {
            throw new IllegalArgumentException("Email must be provided for customer resolution");
        }

        CustomerListParams listParams = CustomerListParams.builder().setEmail(email).setLimit(1L).build();
        List<Customer> existing = call("resolveCustomer", client -> client.customers().list(listParams)).getData();
        if (existing != null && !existing.isEmpty()) {
            return existing.get(0).getId();
        }

        CustomerCreateParams.Builder createParams = CustomerCreateParams.builder()
                .setEmail(email)
                .putMetadata("subscriberId", subscriberId.toString());
        if (StringUtils.hasText(name)) {
            createParams.setName(name);
        }
        CustomerCreateParams built = createParams.build();
        Customer customer = call("createCustomer", client -> client.customers().create(built));
        log.info("Created Stripe customer id={} for subscriber={}", customer.getId(), subscriberId);
        return customer.getId();
    }

    @Override
    public String createRecurringPrice(RecurringPriceRequest request) {
        ProductCreateParams productParams = ProductCreateParams.builder()
                .setName(request.name())
                .setDescription(request.description())
                .putMetadata("planId", request.planId().toString())
                .build();
        Product product = call("createProduct", client -> client.products().create(productParams));

        PriceCreateParams priceParams = PriceCreateParams.builder()
                .setProduct(product.getId())
                .setUnitAmount(request.amount())
                .setCurrency(request.currency().toLowerCase(Locale.ROOT))
                .setRecurring(PriceCreateParams.Recurring.builder()
                        .setInterval(PriceCreateParams.Recurring.Interval.MONTH)
                        .build())
                .putMetadata("planId", request.planId().toString())
                .build();
        Price price = call("createPrice", client -> client.prices().create(priceParams));
        log.info("Provisioned Stripe price id={} product={} for plan={}", price.getId(), product.getId(), request.planId());
        return price.getId();
    }

    private <T> T call(String operation, StripeCall<T> stripeCall) {
        StripeClient client = stripeClientProvider.getIfAvailable();
        if (client == null) {
            metricsService.incrementGatewayFailure(operation, false);
            throw new ExternalGatewayException("Billing provider is not configured", false);
        }
        try {
            try {
                return stripeCall.execute(client);
            } catch (ApiConnectionException first) {
                log.warn("Stripe {} failed to connect, retrying once: {}", operation, first.getMessage());
                return stripeCall.execute(client);
            }
        } catch (StripeException e) {
            boolean retryable = isRetryable(e);
            metricsService.incrementGatewayFailure(operation, retryable);
            log.error("Stripe {} failed (status={}, code={}, retryable={}): {}",
                    operation, e.getStatusCode(), e.getCode(), retryable, e.getMessage());
            throw new ExternalGatewayException("Billing provider call " + operation + " failed", retryable, e.getCode(), e);
        }
    }

    static boolean isRetryable(StripeException e) {
        if (e instanceof ApiConnectionException) {
            return true;
        }
        Integer status = e.getStatusCode();
        return status != null && (status >= 500 || status == 429);
    }
}
