package uk.gegc.creatorbilling.features.billing.api;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import uk.gegc.creatorbilling.features.billing.application.Requester;
import uk.gegc.creatorbilling.shared.exception.UnauthorizedException;

import java.util.UUID;

/**
 * Utility class for extracting the caller from the security context in billing operations.
 */
public final class BillingSecurityUtils {

    public static final String ROLE_ADMIN = "ROLE_ADMIN";

    private BillingSecurityUtils() {
    }

    /**
     * Extract the current user ID from the security context.
     *
     * @throws UnauthorizedException if no authenticated user is found
     */
    public static UUID getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            throw new UnauthorizedException("No authenticated user found");
        }

        String userIdStr = authentication.getName();
        if (userIdStr == null || userIdStr.isEmpty()) {
            throw new UnauthorizedException("User ID not found in authentication");
        }

        try {
            return UUID.fromString(userIdStr);
        } catch (IllegalArgumentException e) {
            throw new UnauthorizedException("Invalid user ID format in authentication");
        }
    }

    public static Requester currentRequester() {
        UUID userId = getCurrentUserId();
        return hasAuthority(ROLE_ADMIN) ? Requester.administrator(userId) : Requester.subscriber(userId);
    }

    public static boolean hasAuthority(String authority) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return false;
        }

        return authentication.getAuthorities().stream()
                .anyMatch(grantedAuthority -> grantedAuthority.getAuthority().equals(authority));
    }
}
