package uk.gegc.creatorbilling.features.billing.api.dto;

import uk.gegc.creatorbilling.features.billing.domain.model.AccessLevel;

import java.util.UUID;

public record AccessLevelDto(UUID subscriberId, AccessLevel accessLevel) {}
