package com.cred.freestyle.warranty.security;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Utility class for security and authorization operations.
 * Provides helper methods for checking caller permissions and extracting caller identity.
 *
 * @author Warranty Platform Team
 */
public class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Get the currently authenticated user ID.
     *
     * @return User ID from authentication context, or null if not authenticated
     */
    public static String getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return null;
        }
        return authentication.getName();
    }

    /**
     * Check if the current user has a specific role.
     *
     * @param role Role to check (without ROLE_ prefix)
     * @return true if user has the role, false otherwise
     */
    public static boolean hasRole(String role) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return false;
        }

        String roleWithPrefix = role.startsWith("ROLE_") ? role : "ROLE_" + role;
        return authentication.getAuthorities().stream()
                .anyMatch(authority -> authority.getAuthority().equals(roleWithPrefix));
    }

    public static boolean isAdmin() {
        return hasRole("ADMIN");
    }

    /**
     * Verify that the current user matches the specified user ID.
     * Administrators may act on any user.
     *
     * @param userId User ID to verify against
     * @throws AccessDeniedException if access is denied
     */
    public static void verifyUserAccess(String userId) {
        String currentUserId = getCurrentUserId();
        if (currentUserId == null) {
            throw new AccessDeniedException("User not authenticated");
        }

        if (isAdmin()) {
            return;
        }

        if (!currentUserId.equals(userId)) {
            throw new AccessDeniedException(
                    "Access denied: User " + currentUserId + " cannot access resources for user " + userId
            );
        }
    }

    /**
     * Actor identifier for audit entries: the caller's ID, or "system" when
     * there is no authenticated caller.
     */
    public static String currentActor() {
        String currentUserId = getCurrentUserId();
        return currentUserId != null ? currentUserId : "system";
    }
}
