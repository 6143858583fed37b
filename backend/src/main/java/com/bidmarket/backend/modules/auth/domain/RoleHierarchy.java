package com.bidmarket.backend.modules.auth.domain;

import java.util.Collection;

/**
 * Privilege ordering over {@link Role}. A user satisfies a required role when its rank is at
 * least the required rank. Unknown user roles rank below every defined role and unknown required
 * roles are satisfied by nobody.
 */
public final class RoleHierarchy {

    private static final int UNKNOWN_RANK = 0;

    private RoleHierarchy() {
    }

    public static int rank(String roleCode) {
        return Role.fromCode(roleCode).map(Role::rank).orElse(UNKNOWN_RANK);
    }

    public static boolean hasRole(String userRole, String requiredRole) {
        int required = rank(requiredRole);
        if (required == UNKNOWN_RANK) {
            return false;
        }
        return rank(userRole) >= required;
    }

    public static boolean hasRole(Role userRole, Role requiredRole) {
        return userRole != null && requiredRole != null && userRole.rank() >= requiredRole.rank();
    }

    /**
     * True when at least one of {@code requiredRoles} is satisfied. An empty requirement set
     * admits nobody.
     */
    public static boolean hasAnyRole(String userRole, Collection<String> requiredRoles) {
        if (requiredRoles == null) {
            return false;
        }
        return requiredRoles.stream().anyMatch(required -> hasRole(userRole, required));
    }
}
