package uk.gegc.creatorbilling.features.billing.infra.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.creatorbilling.features.billing.application.BillingProperties;
import uk.gegc.creatorbilling.features.billing.application.WebhookEventReader;
import uk.gegc.creatorbilling.features.billing.domain.exception.InvalidWebhookSignatureException;
import uk.gegc.creatorbilling.features.billing.domain.model.BillingEvent;
import uk.gegc.creatorbilling.features.billing.domain.model.BillingEventType;
import uk.gegc.creatorbilling.shared.exception.ValidationException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Reads the provider-neutral envelope:
 * <pre>
 * {"external_event_id": "...", "type": "payment.failed", "occurred_at": "2025-01-01T00:00:00Z",
 *  "data": {"external_subscription_id": "...", "status": "past_due",
 *           "current_period_start": "...", "current_period_end": "...",
 *           "cancel_at_period_end": false, "checkout_reference": "..."}}
 * </pre>
 * signed with a hex HMAC-SHA256 of the raw body.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignedEnvelopeEventReader implements WebhookEventReader {

    public static final String PROVIDER = "envelope";

    private final BillingProperties billingProperties;
    private final HmacSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public BillingEvent read(String payload, String signatureHeader) {
        String secret = billingProperties.getWebhookSigningSecret();
        if (!StringUtils.hasText(secret)) {
            log.warn("Webhook signing secret not configured; rejecting request");
            throw new InvalidWebhookSignatureException("Webhook secret not configured");
        }
        if (!StringUtils.hasText(signatureHeader)) {
            throw new InvalidWebhookSignatureException("Missing webhook signature");
        }
        if (!signatureVerifier.verify(payload, signatureHeader, secret)) {
            throw new InvalidWebhookSignatureException("Invalid webhook signature");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed webhook payload", e);
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("Webhook payload must be a JSON object");
        }

        String eventId = requiredText(root, "external_event_id");
        String rawType = requiredText(root, "type");
        Instant occurredAt = requiredInstant(root, "occurred_at");
        JsonNode data = root.path("data");

        return BillingEvent.builder()
                .externalEventId(eventId)
                .provider(PROVIDER)
                .rawType(rawType)
                .type(BillingEventType.fromWireName(rawType).orElse(null))
                .occurredAt(occurredAt)
                .externalSubscriptionId(optionalText(data, "external_subscription_id"))
                .checkoutReference(optionalText(data, "checkout_reference"))
                .providerStatus(ProviderStatusMapper.toLocal(optionalText(data, "status")))
                .currentPeriodStart(optionalInstant(data, "current_period_start"))
                .currentPeriodEnd(optionalInstant(data, "current_period_end"))
                .cancelAtPeriodEnd(data.hasNonNull("cancel_at_period_end")
                        ? data.get("cancel_at_period_end").asBoolean()
                        : null)
                .build();
    }

    private static String requiredText(JsonNode node, String field) {
        String value = optionalText(node, field);
        if (value == null) {
            throw new ValidationException("Webhook payload is missing '" + field + "'");
        }
        return value;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !StringUtils.hasText(value.asText())) {
            return null;
        }
        return value.asText();
    }

    private static Instant requiredInstant(JsonNode node, String field) {
        Instant value = optionalInstant(node, field);
        if (value == null) {
            throw new ValidationException("Webhook payload is missing '" + field + "'");
        }
        return value;
    }

    private static Instant optionalInstant(JsonNode node, String field) {
        String text = optionalText(node, field);
        if (text == null) {
            return null;
        }
        try {
            return Instant.parse(text).truncatedTo(ChronoUnit.MICROS);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Field '" + field + "' is not an ISO-8601 instant: " + text);
        }
    }
}
