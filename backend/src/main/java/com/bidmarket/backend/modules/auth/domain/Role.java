package com.bidmarket.backend.modules.auth.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Marketplace roles, declared from most to least privileged.
 */
public enum Role {
    ADMIN(60),
    MANAGER(50),
    CONTRACTOR(40),
    HOMEOWNER(30),
    WORKER(20),
    USER(10);

    private final int rank;

    Role(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static Optional<Role> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Role.valueOf(code.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
