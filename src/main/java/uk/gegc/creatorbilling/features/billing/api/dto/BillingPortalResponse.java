package uk.gegc.creatorbilling.features.billing.api.dto;

public record BillingPortalResponse(String url, String returnUrl) {}
