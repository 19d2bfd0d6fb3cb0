package com.namehub.model;

/**
 * Caller roles in descending order of privilege.
 */
public enum UserRole {
    ADMIN(2),
    USER(1),
    GUEST(0);

    private final int rank;

    UserRole(int rank) {
        this.rank = rank;
    }

    public boolean satisfies(UserRole required) {
        return rank >= required.rank;
    }
}
