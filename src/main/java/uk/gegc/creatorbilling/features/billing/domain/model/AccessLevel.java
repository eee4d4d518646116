package uk.gegc.creatorbilling.features.billing.domain.model;

public enum AccessLevel {
    FREE,
    PREMIUM
}
