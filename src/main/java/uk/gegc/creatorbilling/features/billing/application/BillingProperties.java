package uk.gegc.creatorbilling.features.billing.application;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Provider-neutral billing configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "billing")
@Validated
@Data
public class BillingProperties {

    /**
     * Shared secret for the HMAC-SHA256 signature on the canonical webhook envelope.
     */
    private String webhookSigningSecret;

    /**
     * Header carrying the hex-encoded envelope signature.
     */
    private String signatureHeader = "Billing-Signature";

    /**
     * Where the billing portal sends the subscriber back to when no return URL is supplied.
     */
    private String portalReturnUrl = "http://localhost:3000/account/billing";

    /**
     * Upper bound accepted for a trial period on checkout.
     */
    @Min(0)
    @Max(730)
    private int maxTrialDays = 365;

    /**
     * Window used for churn in the creator stats summary.
     */
    @Positive
    private int churnWindowDays = 30;
}
