package com.namehub.model;

public enum SeasonStatus {
    DRAFT,
    ACTIVE,
    ENDED,
    CANCELLED;

    public boolean isTerminal() {
        return switch (this) {
            case ENDED, CANCELLED -> true;
            case DRAFT, ACTIVE -> false;
        };
    }
}
