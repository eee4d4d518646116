package uk.gegc.creatorbilling.features.billing.infra.stripe;

import com.stripe.StripeClient;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.creatorbilling.features.billing.application.StripeProperties;

/**
 * Stripe client configuration.
 * SDK-level retries are disabled; {@link StripeBillingGateway} owns the retry policy.
 */
@Configuration
@RequiredArgsConstructor
public class StripeClientConfig {

    private final StripeProperties stripe;

    /**
     * Provide a reusable StripeClient only when the secret key is configured.
     */
    @Bean
    @ConditionalOnProperty(name = "stripe.secret-key")
    public StripeClient stripeClient() {
        return StripeClient.builder()
                .setApiKey(stripe.getSecretKey())
                .setConnectTimeout(stripe.getConnectTimeoutMs())
                .setReadTimeout(stripe.getReadTimeoutMs())
                .setMaxNetworkRetries(0)
                .build();
    }
}
