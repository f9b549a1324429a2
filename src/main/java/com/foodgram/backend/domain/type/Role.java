package com.foodgram.backend.domain.type;

public enum Role {
    USER,
    MODERATOR,
    ADMIN;

    public boolean isStaff() {
        return this == MODERATOR || this == ADMIN;
    }

    public String authority() {
        return "ROLE_" + name();
    }
}
