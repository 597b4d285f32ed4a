package com.cred.freestyle.lottery.security;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Helpers for reading the caller identity from the security context.
 *
 * @author Lottery Back Office Team
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Get the currently authenticated user ID.
     *
     * @return User ID from authentication context, or null if not authenticated
     */
    public static String getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.isAuthenticated()
                && !(authentication instanceof AnonymousAuthenticationToken)) {
            Object principal = authentication.getPrincipal();
            if (principal instanceof String) {
                return (String) principal;
            }
        }

        return null;
    }

    /**
     * Get the current user ID or fail.
     *
     * @return User ID
     * @throws AccessDeniedException if the request is not authenticated
     */
    public static String requireCurrentUserId() {
        String userId = getCurrentUserId();
        if (userId == null) {
            throw new AccessDeniedException("User not authenticated");
        }
        return userId;
    }
}
