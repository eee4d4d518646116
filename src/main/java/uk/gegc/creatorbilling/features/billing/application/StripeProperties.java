package uk.gegc.creatorbilling.features.billing.application;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Stripe configuration properties: keys, redirect URLs and client timeouts.
 */
@Configuration
@ConfigurationProperties(prefix = "stripe")
@Data
public class StripeProperties {
    /** Secret API key (server-side). */
    private String secretKey;

    /** Webhook signing secret for signature verification. */
    private String webhookSecret;

    /** Success redirect URL for Checkout Sessions. */
    private String successUrl;

    /** Cancel redirect URL for Checkout Sessions. */
    private String cancelUrl;

    private int connectTimeoutMs = 10_000;

    private int readTimeoutMs = 30_000;
}
