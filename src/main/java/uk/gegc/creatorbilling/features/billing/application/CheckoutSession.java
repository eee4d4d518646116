package uk.gegc.creatorbilling.features.billing.application;

public record CheckoutSession(String sessionId, String url) {
}
