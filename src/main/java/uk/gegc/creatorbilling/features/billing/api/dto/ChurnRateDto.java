package uk.gegc.creatorbilling.features.billing.api.dto;

public record ChurnRateDto(int windowDays, double churnRate) {}
