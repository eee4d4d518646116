package uk.gegc.creatorbilling.features.billing.application;

import java.util.UUID;

public record RecurringPriceRequest(UUID planId, String name, String description, long amount, String currency) {
}
