package com.catalogsync.crawl.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum SessionStatus {
    COLLECTING_URLS,
    AWAITING_CONFIRMATION,
    PARSING_PRODUCTS,
    COMPLETE,
    CANCELED,
    ERROR;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == CANCELED || this == ERROR;
    }

    public Set<SessionStatus> allowedNext() {
        return switch (this) {
            case COLLECTING_URLS -> EnumSet.of(AWAITING_CONFIRMATION, PARSING_PRODUCTS, CANCELED, ERROR);
            case AWAITING_CONFIRMATION -> EnumSet.of(PARSING_PRODUCTS, CANCELED, ERROR);
            case PARSING_PRODUCTS -> EnumSet.of(COMPLETE, CANCELED, ERROR);
            case COMPLETE, CANCELED, ERROR -> EnumSet.noneOf(SessionStatus.class);
        };
    }

    public boolean canTransitionTo(SessionStatus next) {
        return next != null && allowedNext().contains(next);
    }

    public static SessionStatus fromDbValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return SessionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
