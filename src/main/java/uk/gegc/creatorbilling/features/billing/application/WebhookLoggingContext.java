package uk.gegc.creatorbilling.features.billing.application;

import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging context for webhook processing.
 * Provides consistent logging fields across all webhook handlers.
 */
@Data
@Builder
public class WebhookLoggingContext {

    public static final String EVENT_ID = "billing_event_id";
    public static final String EVENT_TYPE = "billing_event_type";
    public static final String PROVIDER = "billing_provider";
    public static final String SUBSCRIPTION_ID = "billing_subscription_id";
    public static final String SUBSCRIBER_ID = "subscriber_id";

    private String eventId;
    private String eventType;
    private String provider;
    private String subscriptionId;
    private UUID subscriberId;

    /**
     * Set MDC context for structured logging.
     */
    public void setMDC() {
        if (eventId != null) MDC.put(EVENT_ID, eventId);
        if (eventType != null) MDC.put(EVENT_TYPE, eventType);
        if (provider != null) MDC.put(PROVIDER, provider);
        if (subscriptionId != null) MDC.put(SUBSCRIPTION_ID, subscriptionId);
        if (subscriberId != null) MDC.put(SUBSCRIBER_ID, subscriberId.toString());
    }

    public static void clearMDC() {
        MDC.remove(EVENT_ID);
        MDC.remove(EVENT_TYPE);
        MDC.remove(PROVIDER);
        MDC.remove(SUBSCRIPTION_ID);
        MDC.remove(SUBSCRIBER_ID);
    }

    public void logInfo(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.info(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logWarn(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.warn(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logError(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.error(message, args);
        } finally {
            clearMDC();
        }
    }
}
