package uk.gegc.creatorbilling.features.billing.infra.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.net.Webhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.creatorbilling.features.billing.application.StripeProperties;
import uk.gegc.creatorbilling.features.billing.application.WebhookEventReader;
import uk.gegc.creatorbilling.features.billing.domain.exception.InvalidWebhookSignatureException;
import uk.gegc.creatorbilling.features.billing.domain.model.BillingEvent;
import uk.gegc.creatorbilling.features.billing.domain.model.BillingEventType;
import uk.gegc.creatorbilling.shared.exception.ValidationException;

import java.time.Instant;

/**
 * Verifies {@code Stripe-Signature} and translates Stripe subscription lifecycle events.
 *
 * <p>Subscription and invoice events carry our checkout reference in the subscription metadata, so they
 * still find their local row when they arrive before {@code checkout.session.completed}.
 *
 * <p>Stripe's {@code created} timestamp has second resolution, so two events for the same subscription
 * within one second order as equal and the later one is ignored as stale.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StripeEventReader implements WebhookEventReader {

    public static final String PROVIDER = "stripe";

    private static final long SIGNATURE_TOLERANCE_SECONDS = 300;

    // written onto the Stripe subscription's metadata at checkout
    private static final String CHECKOUT_REFERENCE_KEY = "checkoutReference";

    private final StripeProperties stripeProperties;
    private final ObjectMapper objectMapper;

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public BillingEvent read(String payload, String signatureHeader) {
        String webhookSecret = stripeProperties.getWebhookSecret();
        if (!StringUtils.hasText(webhookSecret)) {
            log.warn("Stripe webhook secret not configured; rejecting request");
            throw new InvalidWebhookSignatureException("Webhook secret not configured");
        }
        if (!StringUtils.hasText(signatureHeader)) {
            throw new InvalidWebhookSignatureException("Missing Stripe signature");
        }

        try {
            Webhook.Signature.verifyHeader(payload, signatureHeader, webhookSecret, SIGNATURE_TOLERANCE_SECONDS);
        } catch (SignatureVerificationException e) {
            log.warn("Stripe webhook signature verification failed: {}", e.getMessage());
            throw new InvalidWebhookSignatureException("Invalid Stripe signature");
        }

        JsonNode event;
        try {
            event = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed Stripe event payload", e);
        }

        String eventId = text(event, "id");
        String eventType = text(event, "type");
        Instant created = epoch(event, "created");
        if (eventId == null || eventType == null || created == null) {
            throw new ValidationException("Stripe event is missing id, type or created");
        }
        JsonNode object = event.path("data").path("object");

        BillingEvent.BillingEventBuilder builder = BillingEvent.builder()
                .externalEventId(eventId)
                .provider(PROVIDER)
                .rawType(eventType)
                .occurredAt(created);

        switch (eventType) {
            case "checkout.session.completed" -> builder
                    .type(BillingEventType.CHECKOUT_COMPLETED)
                    .externalSubscriptionId(text(object, "subscription"))
                    .checkoutReference(text(object, "client_reference_id"));
            case "invoice.payment_succeeded", "invoice.paid" -> invoice(builder, object)
                    .type(BillingEventType.PAYMENT_SUCCEEDED);
            case "invoice.payment_failed" -> invoice(builder, object)
                    .type(BillingEventType.PAYMENT_FAILED);
            case "customer.subscription.updated" -> subscription(builder, object)
                    .type(BillingEventType.SUBSCRIPTION_UPDATED);
            case "customer.subscription.deleted" -> subscription(builder, object)
                    .type(BillingEventType.SUBSCRIPTION_DELETED);
            default -> log.debug("Stripe event type {} is not reconciled", eventType);
        }
        return builder.build();
    }

    private BillingEvent.BillingEventBuilder invoice(BillingEvent.BillingEventBuilder builder, JsonNode invoice) {
        String subscriptionId = text(invoice, "subscription");
        if (subscriptionId == null) {
            subscriptionId = text(invoice.path("parent").path("subscription_details"), "subscription");
        }
        String checkoutReference = text(invoice.path("parent").path("subscription_details").path("metadata"),
                CHECKOUT_REFERENCE_KEY);
        if (checkoutReference == null) {
            checkoutReference = text(invoice.path("subscription_details").path("metadata"), CHECKOUT_REFERENCE_KEY);
        }
        JsonNode period = invoice.path("lines").path("data").path(0).path("period");
        return builder
                .externalSubscriptionId(subscriptionId)
                .checkoutReference(checkoutReference)
                .currentPeriodStart(epoch(period, "start"))
                .currentPeriodEnd(epoch(period, "end"));
    }

    private BillingEvent.BillingEventBuilder subscription(BillingEvent.BillingEventBuilder builder, JsonNode subscription) {
        Instant periodStart = epoch(subscription, "current_period_start");
        Instant periodEnd = epoch(subscription, "current_period_end");
        if (periodStart == null || periodEnd == null) {
            JsonNode item = subscription.path("items").path("data").path(0);
            periodStart = periodStart != null ? periodStart : epoch(item, "current_period_start");
            periodEnd = periodEnd != null ? periodEnd : epoch(item, "current_period_end");
        }
        return builder
                .externalSubscriptionId(text(subscription, "id"))
                .checkoutReference(text(subscription.path("metadata"), CHECKOUT_REFERENCE_KEY))
                .providerStatus(ProviderStatusMapper.toLocal(text(subscription, "status")))
                .currentPeriodStart(periodStart)
                .currentPeriodEnd(periodEnd)
                .cancelAtPeriodEnd(subscription.hasNonNull("cancel_at_period_end")
                        ? subscription.get("cancel_at_period_end").asBoolean()
                        : null);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || !StringUtils.hasText(value.asText())) {
            return null;
        }
        return value.asText();
    }

    private static Instant epoch(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToLong()) {
            return null;
        }
        return Instant.ofEpochSecond(value.asLong());
    }
}
