package uk.gegc.creatorbilling.features.billing.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.creatorbilling.features.billing.application.BillingWebhookService;
import uk.gegc.creatorbilling.features.billing.domain.exception.InvalidWebhookSignatureException;
import uk.gegc.creatorbilling.features.billing.domain.exception.UnknownSubscriptionException;
import uk.gegc.creatorbilling.features.billing.domain.model.WebhookOutcome;
import uk.gegc.creatorbilling.shared.config.FeatureFlags;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Billing webhook endpoints")
class BillingWebhookControllerTest {

    private static final String PAYLOAD = "{\"external_event_id\":\"evt_1\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private BillingWebhookService webhookService;

    @MockitoBean
    private FeatureFlags featureFlags;

    @BeforeEach
    void setUp() {
        when(featureFlags.isBilling()).thenReturn(true);
        when(featureFlags.isStripeWebhooks()).thenReturn(true);
    }

    @Test
    @DisplayName("acknowledges every terminal outcome with 200 and no authentication")
    void acknowledgesOutcome() throws Exception {
        // Given
        when(webhookService.process("envelope", PAYLOAD, "abc123")).thenReturn(WebhookOutcome.IGNORED_STALE);

        // When / Then
        mockMvc.perform(post("/api/v1/billing/webhook")
                        .header("Billing-Signature", "abc123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PAYLOAD))
                .andExpect(status().isOk())
                .andExpect(content().string(""));
    }

    @Test
    @DisplayName("acknowledges recorded failures so the provider stops redelivering")
    void acknowledgesFailed() throws Exception {
        when(webhookService.process("envelope", PAYLOAD, "abc123")).thenReturn(WebhookOutcome.FAILED);

        mockMvc.perform(post("/api/v1/billing/webhook")
                        .header("Billing-Signature", "abc123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PAYLOAD))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("answers 400 with a problem detail for a bad signature")
    void badSignature() throws Exception {
        // Given
        when(webhookService.process("envelope", PAYLOAD, "forged"))
                .thenThrow(new InvalidWebhookSignatureException("Invalid webhook signature"));

        // When / Then
        mockMvc.perform(post("/api/v1/billing/webhook")
                        .header("Billing-Signature", "forged")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PAYLOAD))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Webhook Invalid Signature"))
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    @DisplayName("answers 500 for an unknown subscription so the provider retries")
    void unknownSubscription() throws Exception {
        // Given
        when(webhookService.process("stripe", PAYLOAD, "t=1,v1=abc"))
                .thenThrow(new UnknownSubscriptionException("No subscription matches event evt_1"));

        // When / Then
        mockMvc.perform(post("/api/v1/billing/stripe/webhook")
                        .header("Stripe-Signature", "t=1,v1=abc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PAYLOAD))
                .andExpect(status().isInternalServerError());
    }

    @Test
    @DisplayName("answers 404 when Stripe webhooks are switched off")
    void stripeDisabled() throws Exception {
        // Given
        when(featureFlags.isStripeWebhooks()).thenReturn(false);

        // When / Then
        mockMvc.perform(post("/api/v1/billing/stripe/webhook")
                        .header("Stripe-Signature", "t=1,v1=abc")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PAYLOAD))
                .andExpect(status().isNotFound());
        verify(webhookService, never()).process(eq("stripe"), anyString(), anyString());
    }

    @Test
    @DisplayName("answers 404 when billing is switched off")
    void billingDisabled() throws Exception {
        // Given
        when(featureFlags.isBilling()).thenReturn(false);

        // When / Then
        mockMvc.perform(post("/api/v1/billing/webhook")
                        .header("Billing-Signature", "abc123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PAYLOAD))
                .andExpect(status().isNotFound());
    }
}
