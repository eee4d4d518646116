package uk.gegc.creatorbilling.features.billing.application;

import java.util.UUID;

/**
 * The authenticated caller of a user-initiated action.
 */
public record Requester(UUID id, boolean admin) {

    public static Requester subscriber(UUID id) {
        return new Requester(id, false);
    }

    public static Requester administrator(UUID id) {
        return new Requester(id, true);
    }

    public boolean mayActOn(UUID ownerId) {
        return admin || (id != null && id.equals(ownerId));
    }
}
