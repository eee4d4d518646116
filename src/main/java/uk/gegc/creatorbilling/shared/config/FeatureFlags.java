package uk.gegc.creatorbilling.shared.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for feature flags
 */
@Component
@ConfigurationProperties(prefix = "creatorbilling.features")
public class FeatureFlags {

    private boolean billing = true;
    private boolean stripeWebhooks = true;

    public boolean isBilling() {
        return billing;
    }

    public void setBilling(boolean billing) {
        this.billing = billing;
    }

    public boolean isStripeWebhooks() {
        return stripeWebhooks;
    }

    public void setStripeWebhooks(boolean stripeWebhooks) {
        this.stripeWebhooks = stripeWebhooks;
    }
}
