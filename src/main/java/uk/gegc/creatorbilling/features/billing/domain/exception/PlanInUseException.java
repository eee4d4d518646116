package uk.gegc.creatorbilling.features.billing.domain.exception;

import java.util.UUID;

public class PlanInUseException extends RuntimeException {

    public PlanInUseException(UUID planId, long references) {
        super("Plan " + planId + " is referenced by " + references + " subscription(s); deactivate it instead");
    }
}
