package uk.gegc.creatorbilling.features.billing.domain.model;

public enum WebhookOutcome {
    APPLIED,
    IGNORED_STALE,
    IGNORED_DUPLICATE,
    IGNORED_UNHANDLED,
    FAILED
}
