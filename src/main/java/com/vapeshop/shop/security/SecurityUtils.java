package com.vapeshop.shop.security;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Helpers for reading the caller from the security context and checking ownership.
 *
 * @author Vape Shop Team
 */
public final class SecurityUtils {

    public static final String ROLE_USER = "ROLE_USER";
    public static final String ROLE_ADMIN = "ROLE_ADMIN";

    private SecurityUtils() {
    }

    /**
     * @return Id of the authenticated caller, or null if the request is anonymous
     */
    public static Long getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null
                || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return null;
        }
        try {
            return Long.parseLong(authentication.getName());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static boolean isAdmin() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return false;
        }
        return authentication.getAuthorities().stream()
                .anyMatch(authority -> ROLE_ADMIN.equals(authority.getAuthority()));
    }

    /**
     * Verify that the caller owns the resource or is an admin.
     *
     * @param ownerId Owner of the resource
     * @throws AccessDeniedException if the caller is anonymous or someone else
     */
    public static void verifyUserAccess(Long ownerId) {
        Long currentUserId = getCurrentUserId();

        if (currentUserId == null) {
            throw new AccessDeniedException("User not authenticated");
        }
        if (isAdmin()) {
            return;
        }
        if (!currentUserId.equals(ownerId)) {
            throw new AccessDeniedException(
                    "Access denied: user " + currentUserId + " cannot access resources of user " + ownerId);
        }
    }

    /**
     * @throws AccessDeniedException if the caller is not an admin
     */
    public static void verifyAdminAccess() {
        if (!isAdmin()) {
            throw new AccessDeniedException("Access denied: admin rights required");
        }
    }
}
